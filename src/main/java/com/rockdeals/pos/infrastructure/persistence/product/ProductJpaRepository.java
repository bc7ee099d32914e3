package com.rockdeals.pos.infrastructure.persistence.product;

import com.rockdeals.pos.domain.product.Product;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Product JPA Repository
 * Spring Data JPA를 통한 Product 엔티티 영구 저장소
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    Optional<Product> findByBarcode(String barcode);

    boolean existsByBarcode(String barcode);

    @Query("SELECT p FROM Product p WHERE p.active = true " +
           "AND p.stockQuantity <= p.lowStockThreshold " +
           "ORDER BY p.stockQuantity ASC, p.name ASC")
    List<Product> findLowStock(Pageable pageable);

    @Query("SELECT p FROM Product p WHERE p.active = true " +
           "AND (:search IS NULL " +
           "     OR LOWER(p.name) LIKE LOWER(CONCAT('%', :search, '%')) " +
           "     OR p.barcode LIKE CONCAT('%', :search, '%')) " +
           "AND (:categoryName IS NULL OR p.categoryName = :categoryName) " +
           "ORDER BY p.name ASC")
    List<Product> search(@Param("search") String search,
                         @Param("categoryName") String categoryName,
                         Pageable pageable);

    /**
     * 조건부 UPDATE로 재고 차감
     *
     * 재고 확인과 차감이 하나의 문장에서 일어나므로 두 POS 세션이
     * 마지막 재고를 동시에 판매해도 한쪽만 성공한다.
     * 벌크 연산 이후 영속성 컨텍스트를 비워 이후 조회가 최신 재고를 읽게 한다.
     *
     * @return 갱신된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Product p SET p.stockQuantity = p.stockQuantity - :quantity, p.updatedAt = :now " +
           "WHERE p.productId = :productId AND p.active = true AND p.stockQuantity >= :quantity")
    int decreaseStock(@Param("productId") Long productId,
                      @Param("quantity") int quantity,
                      @Param("now") LocalDateTime now);

    /**
     * 환불 재고 복구. 같은 행에 대한 차감과 함께 InnoDB 행 락으로 직렬화된다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Product p SET p.stockQuantity = p.stockQuantity + :quantity, p.updatedAt = :now " +
           "WHERE p.productId = :productId")
    int increaseStock(@Param("productId") Long productId,
                      @Param("quantity") int quantity,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Product p SET p.stockQuantity = :stockQuantity, p.updatedAt = :now " +
           "WHERE p.productId = :productId")
    int changeStock(@Param("productId") Long productId,
                    @Param("stockQuantity") int stockQuantity,
                    @Param("now") LocalDateTime now);
}
