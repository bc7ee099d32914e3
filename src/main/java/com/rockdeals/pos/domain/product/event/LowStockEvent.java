package com.rockdeals.pos.domain.product.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 저재고 이벤트
 *
 * 판매 확정으로 상품 재고가 저재고 기준 이하가 되었을 때 발행된다.
 * 커밋 이후에만 처리된다.
 */
@Getter
@AllArgsConstructor
public class LowStockEvent {
    private final Long productId;
    private final String productName;
    private final int remainingStock;
    private final int threshold;
}
