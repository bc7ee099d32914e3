package com.rockdeals.pos.domain.product;

import lombok.Getter;

/**
 * 카탈로그 검색 조건
 *
 * - search: 상품명 또는 바코드 부분 일치 (대소문자 무시)
 * - categoryName: 카테고리 일치
 * - limit: 1~500 범위로 보정, 미지정 시 100
 */
@Getter
public class ProductSearchCondition {

    private final String search;
    private final String categoryName;
    private final int limit;

    private ProductSearchCondition(String search, String categoryName, int limit) {
        this.search = search;
        this.categoryName = categoryName;
        this.limit = limit;
    }

    public static ProductSearchCondition of(String search, String categoryName, Integer limit) {
        return new ProductSearchCondition(
                normalize(search),
                normalize(categoryName),
                clampLimit(limit)
        );
    }

    public static ProductSearchCondition all() {
        return of(null, null, null);
    }

    /**
     * 캐시 키: 정규화된 조건 조합
     */
    public String cacheKey() {
        return (search == null ? "" : search.toLowerCase()) + ":"
                + (categoryName == null ? "" : categoryName) + ":"
                + limit;
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static int clampLimit(Integer limit) {
        if (limit == null) {
            return ProductConstants.DEFAULT_CATALOG_LIMIT;
        }
        return Math.max(ProductConstants.MIN_CATALOG_LIMIT, Math.min(ProductConstants.MAX_CATALOG_LIMIT, limit));
    }
}
