package com.rockdeals.pos.domain.product;

/**
 * ProductConstants - 상품 카탈로그 상수
 */
public class ProductConstants {

    // ========== Stock ==========

    public static final int DEFAULT_LOW_STOCK_THRESHOLD = 10;

    // ========== Catalog Search ==========

    public static final int DEFAULT_CATALOG_LIMIT = 100;
    public static final int MIN_CATALOG_LIMIT = 1;
    public static final int MAX_CATALOG_LIMIT = 500;

    private ProductConstants() {
        throw new AssertionError("ProductConstants는 인스턴스화할 수 없습니다");
    }
}
