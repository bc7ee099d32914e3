package com.rockdeals.pos.domain.sale;

import java.util.List;
import java.util.Optional;

/**
 * SaleRepository - Sale 저장소 (Port)
 */
public interface SaleRepository {

    Sale save(Sale sale);

    Optional<Sale> findById(Long saleId);

    /**
     * 환불용: 판매 행을 쓰기 락으로 조회 (SELECT ... FOR UPDATE)
     */
    Optional<Sale> findByIdForUpdate(Long saleId);

    Optional<Sale> findByReceiptNumber(String receiptNumber);

    boolean existsByReceiptNumber(String receiptNumber);

    /**
     * 판매 목록 (최신순)
     */
    List<Sale> search(SaleSearchCondition condition);

    long count(SaleSearchCondition condition);
}
