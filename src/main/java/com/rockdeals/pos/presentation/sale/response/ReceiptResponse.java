package com.rockdeals.pos.presentation.sale.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.application.sale.dto.ReceiptDto;
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
 * 영수증 응답 DTO
 * 고객/받은 금액/환불 정보가 없으면 해당 필드는 생략된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReceiptResponse {
    @JsonProperty("sale_id")
    private Long saleId;

    @JsonProperty("receipt_number")
    private String receiptNumber;

    @JsonProperty("sold_at")
    private LocalDateTime soldAt;

    @JsonProperty("customer_id")
    private Long customerId;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("items")
    private List<ReceiptLineResponse> items;

    @JsonProperty("subtotal")
    private BigDecimal subtotal;

    @JsonProperty("discount_percent")
    private BigDecimal discountPercent;

    @JsonProperty("discount_amount")
    private BigDecimal discountAmount;

    @JsonProperty("tax_percent")
    private BigDecimal taxPercent;

    @JsonProperty("tax_amount")
    private BigDecimal taxAmount;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("payment_method")
    private PaymentMethod paymentMethod;

    @JsonProperty("amount_tendered")
    private BigDecimal amountTendered;

    @JsonProperty("change_due")
    private BigDecimal changeDue;

    @JsonProperty("status")
    private SaleStatus status;

    @JsonProperty("refund_amount")
    private BigDecimal refundAmount;

    @JsonProperty("refunded_at")
    private LocalDateTime refundedAt;

    public static ReceiptResponse from(ReceiptDto receipt) {
        return ReceiptResponse.builder()
                .saleId(receipt.getSaleId())
                .receiptNumber(receipt.getReceiptNumber())
                .soldAt(receipt.getSoldAt())
                .customerId(receipt.getCustomerId())
                .customerName(receipt.getCustomerName())
                .items(receipt.getLines().stream()
                        .map(ReceiptLineResponse::from)
                        .collect(Collectors.toList()))
                .subtotal(receipt.getSubtotal())
                .discountPercent(receipt.getDiscountPercent())
                .discountAmount(receipt.getDiscountAmount())
                .taxPercent(receipt.getTaxPercent())
                .taxAmount(receipt.getTaxAmount())
                .totalAmount(receipt.getTotalAmount())
                .paymentMethod(receipt.getPaymentMethod())
                .amountTendered(receipt.getAmountTendered())
                .changeDue(receipt.getChangeDue())
                .status(receipt.getStatus())
                .refundAmount(receipt.getRefundAmount())
                .refundedAt(receipt.getRefundedAt())
                .build();
    }
}
