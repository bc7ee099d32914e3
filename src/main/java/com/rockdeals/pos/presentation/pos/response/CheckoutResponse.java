package com.rockdeals.pos.presentation.pos.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 결제 완료 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResponse {
    @JsonProperty("sale_id")
    private Long saleId;

    @JsonProperty("receipt_number")
    private String receiptNumber;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("payment_method")
    private PaymentMethod paymentMethod;

    @JsonProperty("change_due")
    private BigDecimal changeDue;
}
