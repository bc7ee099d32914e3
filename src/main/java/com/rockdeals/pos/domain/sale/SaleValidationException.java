package com.rockdeals.pos.domain.sale;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 판매 저장소가 요청을 거절한 경우 (존재하지 않는 고객, 비활성 상품 등)
 */
public class SaleValidationException extends DomainException {

    private final String field;
    private final String reason;

    public SaleValidationException(String field, String reason) {
        super(ErrorCode.SALE_VALIDATION_FAILED, field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        details.put("reason", reason);
        return details;
    }
}
