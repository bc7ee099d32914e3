package com.rockdeals.pos.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * ProductRepository - Product 저장소 (Port)
 */
public interface ProductRepository {

    Optional<Product> findById(Long productId);

    Optional<Product> findByBarcode(String barcode);

    List<Product> findAllById(Collection<Long> productIds);

    /**
     * 활성 상품 검색 (이름순)
     */
    List<Product> search(ProductSearchCondition condition);

    /**
     * 재고 원자적 차감
     * UPDATE ... SET stock = stock - quantity WHERE id = ? AND stock >= quantity AND is_active
     *
     * @return 갱신된 행 수 (0이면 상품 없음, 비활성, 또는 재고 부족)
     */
    int decreaseStock(Long productId, int quantity);

    /**
     * 재고 원자적 증가 (환불 복구)
     * UPDATE ... SET stock = stock + quantity WHERE id = ?
     * 비활성 상품도 복구한다.
     *
     * @return 갱신된 행 수 (0이면 상품 없음)
     */
    int increaseStock(Long productId, int quantity);

    /**
     * 재고 수량 직접 지정 (재고 실사)
     *
     * @return 갱신된 행 수 (0이면 상품 없음)
     */
    int changeStock(Long productId, int stockQuantity);

    /**
     * 저재고 활성 상품 (재고 오름차순)
     * stock_quantity <= low_stock_threshold
     */
    List<Product> findLowStock(int limit);

    boolean existsByBarcode(String barcode);

    Product save(Product product);
}
