package com.rockdeals.pos.domain.cart;

import com.rockdeals.pos.common.exception.DomainException;
import com.rockdeals.pos.common.exception.ErrorCode;
import com.rockdeals.pos.domain.common.vo.Money;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 현금 결제에서 받은 금액이 합계보다 적은 경우
 *
 * 응답 details:
 * - total: 결제 금액
 * - amount_tendered: 받은 금액
 * - shortfall: 부족 금액
 */
public class InsufficientPaymentException extends DomainException {

    private final Money total;
    private final Money amountTendered;
    private final Money shortfall;

    public InsufficientPaymentException(Money total, Money amountTendered) {
        super(ErrorCode.INSUFFICIENT_PAYMENT,
                String.format("합계: %s, 받은 금액: %s", total.toBigDecimal(), amountTendered.toBigDecimal()));
        this.total = total;
        this.amountTendered = amountTendered;
        this.shortfall = total.subtractOrZero(amountTendered);
    }

    public Money getTotal() {
        return total;
    }

    public Money getAmountTendered() {
        return amountTendered;
    }

    public Money getShortfall() {
        return shortfall;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total", total.toBigDecimal());
        details.put("amount_tendered", amountTendered.toBigDecimal());
        details.put("shortfall", shortfall.toBigDecimal());
        return details;
    }
}
