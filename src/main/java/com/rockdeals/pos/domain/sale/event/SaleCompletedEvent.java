package com.rockdeals.pos.domain.sale.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 판매 확정 이벤트
 * 커밋 이후 카탈로그 캐시 무효화에 사용된다.
 */
@Getter
@AllArgsConstructor
public class SaleCompletedEvent {
    private final Long saleId;
    private final String receiptNumber;
    private final List<Long> productIds;
    private final long totalAmountCents;
}
