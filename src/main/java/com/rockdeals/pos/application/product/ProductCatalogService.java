package com.rockdeals.pos.application.product;

import com.rockdeals.pos.application.product.dto.CatalogPage;
import com.rockdeals.pos.application.product.dto.CatalogProduct;
import com.rockdeals.pos.domain.product.ProductConstants;
import com.rockdeals.pos.domain.product.ProductRepository;
import com.rockdeals.pos.domain.product.ProductSearchCondition;
import com.rockdeals.pos.infrastructure.config.CacheNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductCatalogService - POS 상품 카탈로그
 *
 * 책임:
 * - 활성 상품을 이름/바코드/카테고리로 검색
 * - 저재고 상품 목록 (재고 보충용, 캐시하지 않음)
 *
 * 캐시:
 * - 조건 조합별로 Redis에 캐싱 (sync=true로 만료 직후 동시 조회를 한 번으로 합침)
 * - 판매 확정 후 ProductCatalogCacheListener가 전체 무효화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductCatalogService {

    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    @Cacheable(value = CacheNames.PRODUCT_CATALOG, key = "#condition.cacheKey()", sync = true)
    public CatalogPage listProducts(ProductSearchCondition condition) {
        log.debug("[ProductCatalogService] 카탈로그 조회 (캐시 미스) - key={}", condition.cacheKey());
        List<CatalogProduct> products = productRepository.search(condition).stream()
                .map(CatalogProduct::from)
                .collect(Collectors.toList());
        return new CatalogPage(products, condition.getLimit());
    }

    /**
     * 저재고 활성 상품 (재고 오름차순)
     * 재고를 실시간으로 봐야 하므로 캐시를 거치지 않는다.
     */
    @Transactional(readOnly = true)
    public CatalogPage listLowStockProducts(Integer limit) {
        int clamped = limit == null ? ProductConstants.DEFAULT_CATALOG_LIMIT
                : Math.max(ProductConstants.MIN_CATALOG_LIMIT, Math.min(ProductConstants.MAX_CATALOG_LIMIT, limit));
        List<CatalogProduct> products = productRepository.findLowStock(clamped).stream()
                .map(CatalogProduct::from)
                .collect(Collectors.toList());
        return new CatalogPage(products, clamped);
    }
}
