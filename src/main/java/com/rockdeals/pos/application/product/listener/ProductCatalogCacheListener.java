package com.rockdeals.pos.application.product.listener;

import com.rockdeals.pos.domain.product.event.ProductChangedEvent;
import com.rockdeals.pos.domain.sale.event.SaleCompletedEvent;
import com.rockdeals.pos.domain.sale.event.SaleRefundedEvent;
import com.rockdeals.pos.infrastructure.config.CacheNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * ProductCatalogCacheListener - 판매 확정/환불, 상품 변경 후 카탈로그 캐시 무효화
 *
 * 카탈로그 응답에 재고 수량이 포함되므로 판매, 환불, 상품 변경이 커밋되면 캐시를 비운다.
 * 캐시 오류는 판매 결과에 영향을 주지 않도록 로그만 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductCatalogCacheListener {

    private final CacheManager cacheManager;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleSaleCompleted(SaleCompletedEvent event) {
        evictCatalog("판매", event.getSaleId(), event.getProductIds());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleSaleRefunded(SaleRefundedEvent event) {
        evictCatalog("환불", event.getSaleId(), event.getProductIds());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleProductChanged(ProductChangedEvent event) {
        try {
            Cache cache = cacheManager.getCache(CacheNames.PRODUCT_CATALOG);
            if (cache != null) {
                cache.clear();
            }
            log.info("[ProductCatalogCacheListener] 카탈로그 캐시 무효화 (상품 {}) - productId={}",
                    event.getChangeType(), event.getProductId());
        } catch (RuntimeException e) {
            log.error("[ProductCatalogCacheListener] 카탈로그 캐시 무효화 실패 (상품 {}) - productId={}, error={}",
                    event.getChangeType(), event.getProductId(), e.getMessage(), e);
        }
    }

    private void evictCatalog(String trigger, Long saleId, List<Long> productIds) {
        try {
            Cache cache = cacheManager.getCache(CacheNames.PRODUCT_CATALOG);
            if (cache != null) {
                cache.clear();
            }
            log.info("[ProductCatalogCacheListener] 카탈로그 캐시 무효화 ({}) - saleId={}, products={}",
                    trigger, saleId, productIds);
        } catch (RuntimeException e) {
            log.error("[ProductCatalogCacheListener] 카탈로그 캐시 무효화 실패 ({}) - saleId={}, error={}",
                    trigger, saleId, e.getMessage(), e);
        }
    }
}
