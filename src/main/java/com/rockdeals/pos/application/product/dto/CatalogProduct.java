package com.rockdeals.pos.application.product.dto;

import com.rockdeals.pos.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 카탈로그 상품 (캐시 직렬화 대상)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogProduct {
    private Long productId;
    private String name;
    private BigDecimal unitPrice;
    private Integer stockQuantity;
    private String barcode;
    private String categoryName;
    private boolean lowStock;

    public static CatalogProduct from(Product product) {
        return CatalogProduct.builder()
                .productId(product.getProductId())
                .name(product.getName())
                .unitPrice(product.getUnitPrice().toBigDecimal())
                .stockQuantity(product.getStockQuantity())
                .barcode(product.getBarcode())
                .categoryName(product.getCategoryName())
                .lowStock(product.isLowStock())
                .build();
    }
}
