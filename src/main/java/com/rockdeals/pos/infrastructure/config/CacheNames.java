package com.rockdeals.pos.infrastructure.config;

import java.time.Duration;

/**
 * 캐시 이름과 TTL
 *
 * 사용: @Cacheable(value = CacheNames.PRODUCT_CATALOG)
 */
public final class CacheNames {

    /** 상품 카탈로그 검색 결과. 판매 확정 후 전체 무효화 */
    public static final String PRODUCT_CATALOG = "productCatalog";

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

    private CacheNames() {
        throw new AssertionError("Instantiation not allowed");
    }
}
