package com.rockdeals.pos.presentation.pos.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 결제수단/받은 금액 변경 요청 DTO (받은 금액은 현금에서만 사용)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {
    @JsonProperty("payment_method")
    private PaymentMethod paymentMethod;

    @JsonProperty("amount_tendered")
    private BigDecimal amountTendered;
}
