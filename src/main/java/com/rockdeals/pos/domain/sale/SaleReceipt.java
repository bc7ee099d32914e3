package com.rockdeals.pos.domain.sale;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 판매 저장 결과: 판매 ID와 영수증 번호
 */
@Getter
@AllArgsConstructor
public class SaleReceipt {
    private final Long saleId;
    private final String receiptNumber;
}
