package com.rockdeals.pos.domain.cart;

/**
 * 결제 수단
 * 거스름돈은 CASH에서만 계산된다.
 */
public enum PaymentMethod {
    CASH,
    CARD;

    public boolean isCash() {
        return this == CASH;
    }
}
