package com.rockdeals.pos.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.application.product.dto.CatalogProduct;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 카탈로그 상품 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("stock_quantity")
    private Integer stockQuantity;

    @JsonProperty("barcode")
    private String barcode;

    @JsonProperty("category_name")
    private String categoryName;

    @JsonProperty("is_low_stock")
    private boolean lowStock;

    public static ProductResponse from(CatalogProduct product) {
        return ProductResponse.builder()
                .productId(product.getProductId())
                .name(product.getName())
                .unitPrice(product.getUnitPrice())
                .stockQuantity(product.getStockQuantity())
                .barcode(product.getBarcode())
                .categoryName(product.getCategoryName())
                .lowStock(product.isLowStock())
                .build();
    }
}
