package com.rockdeals.pos.presentation.sale.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.application.sale.dto.SaleListDto;
import com.rockdeals.pos.application.sale.dto.SaleSummaryDto;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.sale.SaleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 판매 목록 응답 DTO (페이지네이션 포함)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaleListResponse {
    private List<SaleSummary> content;
    @JsonProperty("total_elements")
    private long totalElements;
    @JsonProperty("total_pages")
    private int totalPages;
    @JsonProperty("current_page")
    private int currentPage;
    private int size;

    /**
     * 판매 요약 정보
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SaleSummary {
        @JsonProperty("sale_id")
        private Long saleId;

        @JsonProperty("receipt_number")
        private String receiptNumber;

        @JsonProperty("sold_at")
        private LocalDateTime soldAt;

        @JsonProperty("customer_id")
        private Long customerId;

        @JsonProperty("total_amount")
        private BigDecimal totalAmount;

        @JsonProperty("payment_method")
        private PaymentMethod paymentMethod;

        @JsonProperty("status")
        private SaleStatus status;

        @JsonProperty("refund_amount")
        private BigDecimal refundAmount;

        static SaleSummary from(SaleSummaryDto sale) {
            return SaleSummary.builder()
                    .saleId(sale.getSaleId())
                    .receiptNumber(sale.getReceiptNumber())
                    .soldAt(sale.getSoldAt())
                    .customerId(sale.getCustomerId())
                    .totalAmount(sale.getTotalAmount())
                    .paymentMethod(sale.getPaymentMethod())
                    .status(sale.getStatus())
                    .refundAmount(sale.getRefundAmount())
                    .build();
        }
    }

    public static SaleListResponse from(SaleListDto list) {
        return SaleListResponse.builder()
                .content(list.getContent().stream()
                        .map(SaleSummary::from)
                        .collect(Collectors.toList()))
                .totalElements(list.getTotalElements())
                .totalPages(list.getTotalPages())
                .currentPage(list.getCurrentPage())
                .size(list.getSize())
                .build();
    }
}
