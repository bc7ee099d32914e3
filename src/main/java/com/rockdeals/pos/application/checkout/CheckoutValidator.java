package com.rockdeals.pos.application.checkout;

import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.cart.EmptyCartException;
import com.rockdeals.pos.domain.cart.InsufficientPaymentException;
import com.rockdeals.pos.domain.common.vo.Money;
import org.springframework.stereotype.Component;

/**
 * CheckoutValidator - 결제 전 검증
 *
 * 책임:
 * - 부수 효과 없이 장바구니 상태만 검사
 *
 * 검증 규칙:
 * - 항목이 1개 이상이어야 함
 * - 현금 결제면 받은 금액 >= 합계
 *
 * 재고는 검증하지 않는다. 판매 저장소가 확정 시점에 검증한다.
 */
@Component
public class CheckoutValidator {

    public void validate(Cart cart) {
        if (cart.isEmpty()) {
            throw new EmptyCartException(cart.getCartId());
        }
        if (cart.getPaymentMethod().isCash()) {
            Money total = cart.getTotal();
            Money tendered = cart.getAmountTendered() == null ? Money.ZERO : cart.getAmountTendered();
            if (tendered.isLessThan(total)) {
                throw new InsufficientPaymentException(total, tendered);
            }
        }
    }
}
