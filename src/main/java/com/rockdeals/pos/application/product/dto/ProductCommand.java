package com.rockdeals.pos.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 상품 등록/수정 명령
 * 수정 시 null 필드는 기존 값을 유지한다.
 */
@Getter
@Builder
@AllArgsConstructor
public class ProductCommand {
    private final String name;
    private final String barcode;
    private final String categoryName;
    private final BigDecimal unitPrice;
    private final Integer stockQuantity;
    private final Integer lowStockThreshold;
}
