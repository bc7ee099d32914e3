package com.rockdeals.pos.domain.cart;

/**
 * 장바구니별 결제 시도 상태
 *
 * 상태 전환:
 * IDLE → VALIDATING → SUBMITTING → (확정 | 거절) → IDLE
 *
 * - 확정: 장바구니를 비우고 IDLE로 복귀
 * - 거절: 검증 실패나 저장소 오류, 장바구니는 그대로 두고 IDLE로 복귀
 */
public enum CheckoutState {
    IDLE,
    VALIDATING,
    SUBMITTING;

    public boolean isInFlight() {
        return this != IDLE;
    }
}
