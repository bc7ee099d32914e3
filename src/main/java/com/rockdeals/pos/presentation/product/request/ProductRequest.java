package com.rockdeals.pos.presentation.product.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.application.product.dto.ProductCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 등록/수정 요청 DTO
 * 수정 시 생략한 필드는 기존 값을 유지한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {
    @JsonProperty("name")
    private String name;

    @JsonProperty("barcode")
    private String barcode;

    @JsonProperty("category_name")
    private String categoryName;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("stock_quantity")
    private Integer stockQuantity;

    @JsonProperty("low_stock_threshold")
    private Integer lowStockThreshold;

    public ProductCommand toCommand() {
        return ProductCommand.builder()
                .name(name)
                .barcode(barcode)
                .categoryName(categoryName)
                .unitPrice(unitPrice)
                .stockQuantity(stockQuantity)
                .lowStockThreshold(lowStockThreshold)
                .build();
    }
}
