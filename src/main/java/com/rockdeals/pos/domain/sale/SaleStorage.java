package com.rockdeals.pos.domain.sale;

/**
 * SaleStorage - 판매 저장소 (Port)
 *
 * 책임:
 * - 재고 원자적 차감과 판매 영속화를 한 번의 호출로 수행
 *
 * 실패:
 * - OutOfStockException(productId, available)
 * - SaleValidationException(field, reason)
 * - ServiceUnavailableException
 */
public interface SaleStorage {

    SaleReceipt createSale(SaleRequest request);
}
