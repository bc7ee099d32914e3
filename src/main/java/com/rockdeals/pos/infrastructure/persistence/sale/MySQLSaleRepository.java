package com.rockdeals.pos.infrastructure.persistence.sale;

import com.rockdeals.pos.domain.sale.Sale;
import com.rockdeals.pos.domain.sale.SaleRepository;
import com.rockdeals.pos.domain.sale.SaleSearchCondition;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Sale Repository 구현
 */
@Repository
@Primary
public class MySQLSaleRepository implements SaleRepository {

    private final SaleJpaRepository saleJpaRepository;

    public MySQLSaleRepository(SaleJpaRepository saleJpaRepository) {
        this.saleJpaRepository = saleJpaRepository;
    }

    @Override
    public Sale save(Sale sale) {
        return saleJpaRepository.save(sale);
    }

    @Override
    public Optional<Sale> findById(Long saleId) {
        return saleJpaRepository.findByIdWithItems(saleId);
    }

    @Override
    public Optional<Sale> findByIdForUpdate(Long saleId) {
        return saleJpaRepository.findByIdForUpdate(saleId);
    }

    @Override
    public Optional<Sale> findByReceiptNumber(String receiptNumber) {
        return saleJpaRepository.findByReceiptNumber(receiptNumber);
    }

    @Override
    public boolean existsByReceiptNumber(String receiptNumber) {
        return saleJpaRepository.existsByReceiptNumber(receiptNumber);
    }

    @Override
    public List<Sale> search(SaleSearchCondition condition) {
        return saleJpaRepository.search(
                condition.getStatus(),
                condition.getFrom(),
                condition.getTo(),
                PageRequest.of(condition.getPage(), condition.getSize())
        );
    }

    @Override
    public long count(SaleSearchCondition condition) {
        return saleJpaRepository.countByCondition(condition.getStatus(), condition.getFrom(), condition.getTo());
    }
}
