package com.rockdeals.pos.domain.sale;

import com.rockdeals.pos.domain.common.vo.Money;
import lombok.Getter;

import java.util.Objects;

/**
 * 판매 요청의 상품 한 줄 (불변)
 */
@Getter
public final class SaleLine {

    private final Long productId;
    private final String productName;
    private final int quantity;
    private final Money unitPrice;

    public SaleLine(Long productId, String productName, int quantity, Money unitPrice) {
        this.productId = Objects.requireNonNull(productId, "productId는 null이 될 수 없습니다");
        this.productName = productName;
        this.quantity = quantity;
        this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice는 null이 될 수 없습니다");
    }

    public Money getLineTotal() {
        return unitPrice.multiply(quantity);
    }
}
