package com.rockdeals.pos.domain.customer;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

public class CustomerNotFoundException extends DomainException {

    public CustomerNotFoundException(Long customerId) {
        super(ErrorCode.CUSTOMER_NOT_FOUND, "customerId=" + customerId);
    }
}
