package com.rockdeals.pos.domain.common.vo;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Money Value Object
 *
 * 센트(최소 화폐 단위) 정수로 금액을 표현하는 값 객체입니다.
 * 부동소수점 오차 없이 장바구니 합계, 할인, 세금, 거스름돈을 계산합니다.
 *
 * 사용처:
 * - LineItem (unitPrice, lineTotal)
 * - Cart 파생 값 (subtotal, discountAmount, taxAmount, total, changeDue)
 * - SaleRequest / Sale (판매 확정 금액 스냅샷)
 *
 * 정밀도 정책:
 * - 소수점 2자리 고정
 * - 비율 적용 시 센트 단위로 HALF_UP 반올림
 * - 음수 금액은 허용하지 않음
 */
public final class Money implements Comparable<Money>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static final Money ZERO = new Money(0L);

    private final long cents;

    private Money(long cents) {
        if (cents < 0) {
            throw new IllegalArgumentException("금액은 음수가 될 수 없습니다: " + cents);
        }
        this.cents = cents;
    }

    /**
     * 센트 단위 금액으로 생성합니다.
     *
     * @param cents 센트 금액 (0 이상)
     * @throws IllegalArgumentException cents < 0인 경우
     */
    public static Money ofCents(long cents) {
        return cents == 0 ? ZERO : new Money(cents);
    }

    /**
     * 소수 금액(예: 29.99)으로 생성합니다.
     * 소수점 3자리 이하는 HALF_UP으로 반올림합니다.
     *
     * @throws IllegalArgumentException amount < 0이거나 센트 범위를 넘는 경우
     */
    public static Money of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount는 null이 될 수 없습니다");
        BigDecimal scaled = amount.setScale(SCALE, RoundingMode.HALF_UP);
        try {
            return ofCents(scaled.movePointRight(SCALE).longValueExact());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("표현할 수 없는 금액입니다: " + amount.toPlainString(), e);
        }
    }

    public static Money of(String amount) {
        return of(new BigDecimal(amount));
    }

    public long getCents() {
        return cents;
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(cents, SCALE);
    }

    public Money add(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return ofCents(Math.addExact(this.cents, other.cents));
    }

    /**
     * 두 금액을 뺍니다.
     *
     * @throws IllegalArgumentException 결과가 음수가 되는 경우
     */
    public Money subtract(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        long result = this.cents - other.cents;
        if (result < 0) {
            throw new IllegalArgumentException(
                String.format("음수 금액이 될 수 없습니다: %s - %s", this, other)
            );
        }
        return ofCents(result);
    }

    /**
     * 다른 금액을 뺀 값을 반환하되, 음수면 0을 반환합니다.
     * 거스름돈 계산 max(0, a - b)에 사용합니다.
     */
    public Money subtractOrZero(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return this.cents > other.cents ? ofCents(this.cents - other.cents) : ZERO;
    }

    public Money multiply(long multiplier) {
        if (multiplier < 0) {
            throw new IllegalArgumentException("배수는 음수가 될 수 없습니다: " + multiplier);
        }
        return ofCents(Math.multiplyExact(this.cents, multiplier));
    }

    /**
     * 금액의 percent% 를 센트 단위 HALF_UP 반올림으로 계산합니다.
     * 예: 59.98 의 15% = 8.997 → 9.00
     *
     * @param percent 0 이상의 비율 (15 = 15%)
     * @throws IllegalArgumentException percent < 0인 경우
     */
    public Money percentage(BigDecimal percent) {
        Objects.requireNonNull(percent, "percent는 null이 될 수 없습니다");
        if (percent.signum() < 0) {
            throw new IllegalArgumentException("비율은 음수가 될 수 없습니다: " + percent);
        }
        BigDecimal result = BigDecimal.valueOf(cents)
                .multiply(percent)
                .divide(HUNDRED, 0, RoundingMode.HALF_UP);
        return ofCents(result.longValueExact());
    }

    public boolean isGreaterThanOrEqual(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return this.cents >= other.cents;
    }

    public boolean isGreaterThan(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return this.cents > other.cents;
    }

    public boolean isLessThan(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return this.cents < other.cents;
    }

    public boolean isZero() {
        return this.cents == 0;
    }

    @Override
    public int compareTo(Money other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return Long.compare(this.cents, other.cents);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Money)) {
            return false;
        }
        Money other = (Money) obj;
        return this.cents == other.cents;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(cents);
    }

    @Override
    public String toString() {
        return "Money(" + toBigDecimal().toPlainString() + ")";
    }
}
