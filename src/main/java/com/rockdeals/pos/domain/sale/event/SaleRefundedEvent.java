package com.rockdeals.pos.domain.sale.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 판매 환불 이벤트
 * 환불로 재고가 복구되므로 커밋 이후 카탈로그 캐시를 비운다.
 */
@Getter
@AllArgsConstructor
public class SaleRefundedEvent {
    private final Long saleId;
    private final String receiptNumber;
    private final List<Long> productIds;
    private final long refundAmountCents;
}
