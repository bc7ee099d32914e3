package com.rockdeals.pos.domain.product;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
    }

    public ProductNotFoundException(String barcode) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "barcode=" + barcode);
    }
}
