package com.rockdeals.pos.domain.sale;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

public class SaleNotFoundException extends DomainException {

    public SaleNotFoundException(Long saleId) {
        super(ErrorCode.SALE_NOT_FOUND, "saleId=" + saleId);
    }
}
