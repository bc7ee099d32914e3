package com.rockdeals.pos.domain.product;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

public class DuplicateBarcodeException extends DomainException {

    public DuplicateBarcodeException(String barcode) {
        super(ErrorCode.DUPLICATE_BARCODE, "barcode=" + barcode);
    }
}
