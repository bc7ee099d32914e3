package com.rockdeals.pos.application.sale.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 판매 환불 결과
 */
@Getter
@Builder
@AllArgsConstructor
public class RefundResult {
    private final Long saleId;
    private final String receiptNumber;
    private final BigDecimal refundAmount;
    private final LocalDateTime refundedAt;
    private final List<RestoredItem> restoredItems;

    /**
     * 재고가 복구된 상품과 수량
     */
    @Getter
    @AllArgsConstructor
    public static class RestoredItem {
        private final Long productId;
        private final int quantity;
    }
}
