package com.rockdeals.pos.domain.cart;

import com.rockdeals.pos.domain.common.vo.Money;
import lombok.Getter;

import java.util.Objects;

/**
 * LineItem - 장바구니의 상품 한 줄
 *
 * 비즈니스 규칙:
 * - 수량은 항상 1 이상 (0 이하가 되면 Cart가 항목을 제거)
 * - 단가와 재고는 담는 시점의 스냅샷
 * - availableStock은 화면 안내용이며 판매 확정 시 재고는 저장소가 검증
 */
@Getter
public class LineItem {

    private final Long productId;
    private final String name;
    private final Money unitPrice;
    private final int availableStock;
    private int quantity;

    LineItem(Long productId, String name, Money unitPrice, int availableStock) {
        this.productId = Objects.requireNonNull(productId, "productId는 null이 될 수 없습니다");
        this.name = name;
        this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice는 null이 될 수 없습니다");
        this.availableStock = Math.max(0, availableStock);
        this.quantity = CartConstants.MIN_LINE_QUANTITY;
    }

    void increase() {
        this.quantity = Math.addExact(this.quantity, 1);
    }

    void changeQuantity(int quantity) {
        if (quantity < CartConstants.MIN_LINE_QUANTITY) {
            throw new IllegalArgumentException("항목 수량은 1 이상이어야 합니다: " + quantity);
        }
        this.quantity = quantity;
    }

    public Money getLineTotal() {
        return unitPrice.multiply(quantity);
    }

    /**
     * 담은 수량이 마지막으로 확인한 재고를 넘었는지 여부 (안내용)
     */
    public boolean isStockExceeded() {
        return quantity > availableStock;
    }

    /**
     * 한 개 더 담아도 마지막으로 확인한 재고 이내인지 여부 (안내용)
     */
    public boolean canAddMore() {
        return quantity < availableStock;
    }
}
