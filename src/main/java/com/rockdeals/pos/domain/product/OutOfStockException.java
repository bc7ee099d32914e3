package com.rockdeals.pos.domain.product;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 판매 확정 시점에 재고가 요청 수량보다 적은 경우 (409)
 *
 * 장바구니는 그대로 남으므로 운영자가 수량을 줄이고 다시 결제할 수 있다.
 */
public class OutOfStockException extends DomainException {

    private final Long productId;
    private final int requested;
    private final int available;

    public OutOfStockException(Long productId, int requested, int available) {
        super(ErrorCode.OUT_OF_STOCK,
                String.format("productId=%d, 요청: %d, 재고: %d", productId, requested, available));
        this.productId = productId;
        this.requested = requested;
        this.available = available;
    }

    public Long getProductId() {
        return productId;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("product_id", productId);
        details.put("requested", requested);
        details.put("available", available);
        return details;
    }
}
