package com.rockdeals.pos.domain.cart;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

import java.math.BigDecimal;

public class InvalidTaxRateException extends DomainException {

    public InvalidTaxRateException(BigDecimal taxPercent) {
        super(ErrorCode.INVALID_TAX_RATE, "입력값: " + taxPercent);
    }
}
