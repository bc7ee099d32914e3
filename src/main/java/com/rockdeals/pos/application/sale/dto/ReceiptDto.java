package com.rockdeals.pos.application.sale.dto;

import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.sale.SaleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 영수증 조회 결과
 * 금액은 소수점 2자리 BigDecimal
 */
@Getter
@Builder
@AllArgsConstructor
public class ReceiptDto {
    private final Long saleId;
    private final String receiptNumber;
    private final LocalDateTime soldAt;
    private final Long customerId;
    private final String customerName;
    private final List<ReceiptLineDto> lines;
    private final BigDecimal subtotal;
    private final BigDecimal discountPercent;
    private final BigDecimal discountAmount;
    private final BigDecimal taxPercent;
    private final BigDecimal taxAmount;
    private final BigDecimal totalAmount;
    private final PaymentMethod paymentMethod;
    private final BigDecimal amountTendered;
    private final BigDecimal changeDue;
    private final SaleStatus status;
    private final BigDecimal refundAmount;
    private final LocalDateTime refundedAt;
}
