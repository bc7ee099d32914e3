package com.rockdeals.pos.domain.sale;

import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.cart.LineItem;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.common.vo.Money;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SaleRequest - 판매 저장소로 보내는 장바구니 스냅샷 (불변)
 *
 * 책임:
 * - 결제 시점의 항목, 고객, 금액, 결제수단을 고정
 * - 생성 후 장바구니가 바뀌어도 영향을 받지 않음
 *
 * 상태는 항상 COMPLETED로 제출되며 실제 영속 상태는 저장소가 결정한다.
 */
@Getter
public final class SaleRequest {

    private final String cartId;
    private final List<SaleLine> lines;
    private final Long customerId;
    private final Money subtotal;
    private final BigDecimal discountPercent;
    private final Money discountAmount;
    private final BigDecimal taxPercent;
    private final Money taxAmount;
    private final Money totalAmount;
    private final PaymentMethod paymentMethod;
    private final Money amountTendered;
    private final Money changeDue;
    private final SaleStatus status;

    private SaleRequest(Cart cart) {
        this.cartId = cart.getCartId();
        this.lines = cart.getItems().stream()
                .map(SaleRequest::toLine)
                .collect(Collectors.toUnmodifiableList());
        this.customerId = cart.getCustomerId();
        this.subtotal = cart.getSubtotal();
        this.discountPercent = cart.getDiscountPercent();
        this.discountAmount = cart.getDiscountAmount();
        this.taxPercent = cart.getTaxPercent();
        this.taxAmount = cart.getTaxAmount();
        this.totalAmount = cart.getTotal();
        this.paymentMethod = cart.getPaymentMethod();
        this.amountTendered = cart.getPaymentMethod().isCash() ? cart.getAmountTendered() : null;
        this.changeDue = cart.getChangeDue();
        this.status = SaleStatus.COMPLETED;
    }

    public static SaleRequest from(Cart cart) {
        return new SaleRequest(cart);
    }

    public int getTotalQuantity() {
        return lines.stream().mapToInt(SaleLine::getQuantity).sum();
    }

    private static SaleLine toLine(LineItem lineItem) {
        return new SaleLine(
                lineItem.getProductId(),
                lineItem.getName(),
                lineItem.getQuantity(),
                lineItem.getUnitPrice()
        );
    }
}
