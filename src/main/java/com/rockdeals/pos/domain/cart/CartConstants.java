package com.rockdeals.pos.domain.cart;

import java.math.BigDecimal;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 역할:
 * - 할인율 허용 범위 (입력값은 범위로 보정)
 * - 세율 기본값과 허용 범위 (범위 밖이면 거절)
 * - 받은 금액 상한
 */
public class CartConstants {

    // ========== Discount ==========

    public static final BigDecimal MIN_DISCOUNT_PERCENT = BigDecimal.ZERO;
    public static final BigDecimal MAX_DISCOUNT_PERCENT = BigDecimal.valueOf(100);

    // ========== Tax ==========

    /** pos.cart.default-tax-percent 미설정 시 기본 세율 */
    public static final BigDecimal DEFAULT_TAX_PERCENT = BigDecimal.valueOf(15);

    public static final BigDecimal MAX_TAX_PERCENT = BigDecimal.valueOf(100);

    // ========== Payment ==========

    /** 받은 금액 상한 (센트 long 범위 안에서 합계/거스름돈 계산이 넘치지 않도록) */
    public static final BigDecimal MAX_AMOUNT_TENDERED = new BigDecimal("10000000.00");

    // ========== Line Item ==========

    public static final int MIN_LINE_QUANTITY = 1;

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
