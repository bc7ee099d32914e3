package com.rockdeals.pos.presentation.sale.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.application.sale.dto.RefundResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 판매 환불 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefundResponse {
    @JsonProperty("sale_id")
    private Long saleId;

    @JsonProperty("receipt_number")
    private String receiptNumber;

    @JsonProperty("refund_amount")
    private BigDecimal refundAmount;

    @JsonProperty("refunded_at")
    private LocalDateTime refundedAt;

    @JsonProperty("restored_items")
    private List<RestoredItem> restoredItems;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RestoredItem {
        @JsonProperty("product_id")
        private Long productId;

        @JsonProperty("quantity")
        private Integer quantity;
    }

    public static RefundResponse from(RefundResult result) {
        return RefundResponse.builder()
                .saleId(result.getSaleId())
                .receiptNumber(result.getReceiptNumber())
                .refundAmount(result.getRefundAmount())
                .refundedAt(result.getRefundedAt())
                .restoredItems(result.getRestoredItems().stream()
                        .map(item -> RestoredItem.builder()
                                .productId(item.getProductId())
                                .quantity(item.getQuantity())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
