package com.rockdeals.pos.domain.cart;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

/**
 * 열린 POS 세션에서 장바구니를 찾을 수 없을 때 발생
 */
public class CartNotFoundException extends DomainException {

    private final String cartId;

    public CartNotFoundException(String cartId) {
        super(ErrorCode.CART_NOT_FOUND, "cartId=" + cartId);
        this.cartId = cartId;
    }

    public String getCartId() {
        return cartId;
    }
}
