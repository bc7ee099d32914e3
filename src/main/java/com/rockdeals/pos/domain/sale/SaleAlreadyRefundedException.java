package com.rockdeals.pos.domain.sale;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

public class SaleAlreadyRefundedException extends DomainException {

    public SaleAlreadyRefundedException(Long saleId) {
        super(ErrorCode.SALE_ALREADY_REFUNDED, "saleId=" + saleId);
    }
}
