package com.rockdeals.pos.presentation.pos.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.domain.cart.CheckoutState;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {
    @JsonProperty("cart_id")
    private String cartId;

    @JsonProperty("items")
    private List<LineItemResponse> items;

    @JsonProperty("total_quantity")
    private Integer totalQuantity;

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

    @JsonProperty("total")
    private BigDecimal total;

    @JsonProperty("payment_method")
    private PaymentMethod paymentMethod;

    @JsonProperty("amount_tendered")
    private BigDecimal amountTendered;

    @JsonProperty("change_due")
    private BigDecimal changeDue;

    @JsonProperty("shortfall")
    private BigDecimal shortfall;

    @JsonProperty("customer_id")
    private Long customerId;

    @JsonProperty("checkout_state")
    private CheckoutState checkoutState;
}
