package com.rockdeals.pos.domain.cart;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

/**
 * 항목이 없는 장바구니로 결제를 시도한 경우
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(String cartId) {
        super(ErrorCode.CART_EMPTY, "cartId=" + cartId);
    }
}
