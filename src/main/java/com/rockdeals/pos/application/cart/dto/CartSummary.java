package com.rockdeals.pos.application.cart.dto;

import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.cart.CheckoutState;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 조회 결과
 *
 * 파생 금액은 조회 시점의 장바구니에서 계산한 값이다.
 */
@Getter
@Builder
@AllArgsConstructor
public class CartSummary {
    private final String cartId;
    private final List<LineItemSummary> items;
    private final int totalQuantity;
    private final BigDecimal subtotal;
    private final BigDecimal discountPercent;
    private final BigDecimal discountAmount;
    private final BigDecimal taxPercent;
    private final BigDecimal taxAmount;
    private final BigDecimal total;
    private final PaymentMethod paymentMethod;
    private final BigDecimal amountTendered;
    private final BigDecimal changeDue;
    private final BigDecimal shortfall;
    private final Long customerId;
    private final CheckoutState checkoutState;

    public static CartSummary from(Cart cart) {
        return CartSummary.builder()
                .cartId(cart.getCartId())
                .items(cart.getItems().stream()
                        .map(LineItemSummary::from)
                        .collect(Collectors.toList()))
                .totalQuantity(cart.getTotalQuantity())
                .subtotal(cart.getSubtotal().toBigDecimal())
                .discountPercent(cart.getDiscountPercent())
                .discountAmount(cart.getDiscountAmount().toBigDecimal())
                .taxPercent(cart.getTaxPercent())
                .taxAmount(cart.getTaxAmount().toBigDecimal())
                .total(cart.getTotal().toBigDecimal())
                .paymentMethod(cart.getPaymentMethod())
                .amountTendered(cart.getAmountTendered() == null ? null : cart.getAmountTendered().toBigDecimal())
                .changeDue(cart.getChangeDue().toBigDecimal())
                .shortfall(cart.getShortfall().toBigDecimal())
                .customerId(cart.getCustomerId())
                .checkoutState(cart.getCheckoutState())
                .build();
    }
}
