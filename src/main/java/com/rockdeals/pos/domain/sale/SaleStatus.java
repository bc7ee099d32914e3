package com.rockdeals.pos.domain.sale;

/**
 * 판매 상태
 * POS 결제로 생성되는 판매는 항상 COMPLETED로 제출되고 환불되면 REFUNDED가 된다.
 */
public enum SaleStatus {
    COMPLETED,
    REFUNDED
}
