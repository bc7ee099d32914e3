package com.rockdeals.pos.application.sale.dto;

import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.common.vo.Money;
import com.rockdeals.pos.domain.sale.Sale;
import com.rockdeals.pos.domain.sale.SaleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 판매 목록의 한 줄 (항목은 포함하지 않음)
 */
@Getter
@Builder
@AllArgsConstructor
public class SaleSummaryDto {
    private final Long saleId;
    private final String receiptNumber;
    private final LocalDateTime soldAt;
    private final Long customerId;
    private final BigDecimal totalAmount;
    private final PaymentMethod paymentMethod;
    private final SaleStatus status;
    private final BigDecimal refundAmount;

    public static SaleSummaryDto from(Sale sale) {
        return SaleSummaryDto.builder()
                .saleId(sale.getSaleId())
                .receiptNumber(sale.getReceiptNumber())
                .soldAt(sale.getCreatedAt())
                .customerId(sale.getCustomerId())
                .totalAmount(sale.totalAsMoney().toBigDecimal())
                .paymentMethod(sale.getPaymentMethod())
                .status(sale.getStatus())
                .refundAmount(sale.getRefundAmount() == null ? null : Money.ofCents(sale.getRefundAmount()).toBigDecimal())
                .build();
    }
}
