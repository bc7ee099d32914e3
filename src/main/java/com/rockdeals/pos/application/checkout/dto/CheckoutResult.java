package com.rockdeals.pos.application.checkout.dto;

import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.common.vo.Money;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 결제 완료 결과 (영수증 출력/거스름돈 표시용)
 */
@Getter
@AllArgsConstructor
public class CheckoutResult {
    private final Long saleId;
    private final String receiptNumber;
    private final Money totalAmount;
    private final PaymentMethod paymentMethod;
    private final Money changeDue;
}
