package com.rockdeals.pos.domain.cart;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

import java.math.BigDecimal;

public class InvalidAmountException extends DomainException {

    public InvalidAmountException(BigDecimal amount) {
        super(ErrorCode.INVALID_AMOUNT, "입력값: " + amount);
    }
}
