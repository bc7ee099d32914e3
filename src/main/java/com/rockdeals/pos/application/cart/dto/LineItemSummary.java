package com.rockdeals.pos.application.cart.dto;

import com.rockdeals.pos.domain.cart.LineItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@AllArgsConstructor
public class LineItemSummary {
    private final Long productId;
    private final String name;
    private final BigDecimal unitPrice;
    private final int quantity;
    private final int availableStock;
    private final BigDecimal lineTotal;
    private final boolean stockExceeded;
    private final boolean canAddMore;

    public static LineItemSummary from(LineItem lineItem) {
        return new LineItemSummary(
                lineItem.getProductId(),
                lineItem.getName(),
                lineItem.getUnitPrice().toBigDecimal(),
                lineItem.getQuantity(),
                lineItem.getAvailableStock(),
                lineItem.getLineTotal().toBigDecimal(),
                lineItem.isStockExceeded(),
                lineItem.canAddMore()
        );
    }
}
