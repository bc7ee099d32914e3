package com.rockdeals.pos.infrastructure.persistence.sale;

import com.rockdeals.pos.domain.sale.Sale;
import com.rockdeals.pos.domain.sale.SaleStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface SaleJpaRepository extends JpaRepository<Sale, Long> {

    /**
     * 영수증 조회용: 항목을 함께 로드
     */
    @Query("SELECT DISTINCT s FROM Sale s LEFT JOIN FETCH s.items WHERE s.saleId = :saleId")
    Optional<Sale> findByIdWithItems(@Param("saleId") Long saleId);

    /**
     * 환불용 비관적 락 조회
     * 같은 판매에 대한 동시 환불은 이 락에서 직렬화된다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Sale s WHERE s.saleId = :saleId")
    Optional<Sale> findByIdForUpdate(@Param("saleId") Long saleId);

    Optional<Sale> findByReceiptNumber(String receiptNumber);

    boolean existsByReceiptNumber(String receiptNumber);

    @Query("SELECT s FROM Sale s " +
           "WHERE (:status IS NULL OR s.status = :status) " +
           "AND (:from IS NULL OR s.createdAt >= :from) " +
           "AND (:to IS NULL OR s.createdAt <= :to) " +
           "ORDER BY s.createdAt DESC, s.saleId DESC")
    List<Sale> search(@Param("status") SaleStatus status,
                      @Param("from") LocalDateTime from,
                      @Param("to") LocalDateTime to,
                      Pageable pageable);

    @Query("SELECT COUNT(s) FROM Sale s " +
           "WHERE (:status IS NULL OR s.status = :status) " +
           "AND (:from IS NULL OR s.createdAt >= :from) " +
           "AND (:to IS NULL OR s.createdAt <= :to)")
    long countByCondition(@Param("status") SaleStatus status,
                          @Param("from") LocalDateTime from,
                          @Param("to") LocalDateTime to);
}
