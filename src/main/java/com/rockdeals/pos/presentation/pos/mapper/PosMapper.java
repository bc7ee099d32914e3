package com.rockdeals.pos.presentation.pos.mapper;

import com.rockdeals.pos.application.cart.dto.CartSummary;
import com.rockdeals.pos.application.cart.dto.LineItemSummary;
import com.rockdeals.pos.application.checkout.dto.CheckoutResult;
import com.rockdeals.pos.presentation.pos.response.CartResponse;
import com.rockdeals.pos.presentation.pos.response.CheckoutResponse;
import com.rockdeals.pos.presentation.pos.response.LineItemResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * PosMapper - Application DTO ↔ Presentation DTO 변환
 */
@Component
public class PosMapper {

    public CartResponse toCartResponse(CartSummary summary) {
        return CartResponse.builder()
                .cartId(summary.getCartId())
                .items(summary.getItems().stream()
                        .map(this::toLineItemResponse)
                        .collect(Collectors.toList()))
                .totalQuantity(summary.getTotalQuantity())
                .subtotal(summary.getSubtotal())
                .discountPercent(summary.getDiscountPercent())
                .discountAmount(summary.getDiscountAmount())
                .taxPercent(summary.getTaxPercent())
                .taxAmount(summary.getTaxAmount())
                .total(summary.getTotal())
                .paymentMethod(summary.getPaymentMethod())
                .amountTendered(summary.getAmountTendered())
                .changeDue(summary.getChangeDue())
                .shortfall(summary.getShortfall())
                .customerId(summary.getCustomerId())
                .checkoutState(summary.getCheckoutState())
                .build();
    }

    public LineItemResponse toLineItemResponse(LineItemSummary item) {
        return LineItemResponse.builder()
                .productId(item.getProductId())
                .name(item.getName())
                .unitPrice(item.getUnitPrice())
                .quantity(item.getQuantity())
                .availableStock(item.getAvailableStock())
                .lineTotal(item.getLineTotal())
                .stockExceeded(item.isStockExceeded())
                .canAddMore(item.isCanAddMore())
                .build();
    }

    public CheckoutResponse toCheckoutResponse(CheckoutResult result) {
        return CheckoutResponse.builder()
                .saleId(result.getSaleId())
                .receiptNumber(result.getReceiptNumber())
                .totalAmount(result.getTotalAmount().toBigDecimal())
                .paymentMethod(result.getPaymentMethod())
                .changeDue(result.getChangeDue().toBigDecimal())
                .build();
    }
}
