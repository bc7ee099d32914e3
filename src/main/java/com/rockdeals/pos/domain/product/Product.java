package com.rockdeals.pos.domain.product;

import com.rockdeals.pos.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Product 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 판매 상품 정보(이름, 바코드, 카테고리, 단가) 관리
 * - 재고 수량 및 저재고 판단
 *
 * 핵심 비즈니스 규칙:
 * - 단가는 센트 단위 정수로 저장 (unit_price)
 * - 재고는 0 이상
 * - 재고 변경은 항상 단일 UPDATE 문으로 수행 (decreaseStock, increaseStock, changeStock)
 *   엔티티 저장은 재고 컬럼을 쓰지 않으므로 상품 정보 수정이 동시 판매의 차감을 덮어쓰지 않는다
 * - 비활성 상품은 카탈로그에 노출되지 않고 판매 확정도 거절된다
 * - 삭제는 비활성화로 처리 (판매 항목이 상품 ID를 참조)
 */
@Entity
@Table(name = "products", uniqueConstraints = {
    @UniqueConstraint(columnNames = "barcode")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "barcode", length = 64)
    private String barcode;

    @Column(name = "category_name")
    private String categoryName;

    @Getter(AccessLevel.NONE)
    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;

    @Column(name = "stock_quantity", nullable = false, updatable = false)
    private Integer stockQuantity;

    @Column(name = "low_stock_threshold", nullable = false)
    private Integer lowStockThreshold;

    @Column(name = "is_active", nullable = false)
    private Boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 상품명 필수, 단가와 재고는 0 이상
     * - 저재고 기준 미지정 시 ProductConstants.DEFAULT_LOW_STOCK_THRESHOLD
     */
    public static Product create(String name, String barcode, String categoryName,
                                 Money unitPrice, int stockQuantity, Integer lowStockThreshold,
                                 LocalDateTime now) {
        requireName(name);
        Objects.requireNonNull(unitPrice, "unitPrice는 null이 될 수 없습니다");
        if (stockQuantity < 0) {
            throw new IllegalArgumentException("재고는 음수가 될 수 없습니다: " + stockQuantity);
        }
        return Product.builder()
                .name(name.trim())
                .barcode(normalizeBarcode(barcode))
                .categoryName(categoryName)
                .unitPrice(unitPrice.getCents())
                .stockQuantity(stockQuantity)
                .lowStockThreshold(resolveThreshold(lowStockThreshold))
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 상품 정보 수정. null 인자는 기존 값을 유지한다.
     * 재고는 여기서 바꾸지 않는다 (ProductRepository.changeStock).
     */
    public void update(String name, String barcode, String categoryName,
                       Money unitPrice, Integer lowStockThreshold, LocalDateTime now) {
        if (name != null) {
            requireName(name);
            this.name = name.trim();
        }
        if (barcode != null) {
            this.barcode = normalizeBarcode(barcode);
        }
        if (categoryName != null) {
            this.categoryName = categoryName;
        }
        if (unitPrice != null) {
            this.unitPrice = unitPrice.getCents();
        }
        if (lowStockThreshold != null) {
            this.lowStockThreshold = resolveThreshold(lowStockThreshold);
        }
        this.updatedAt = now;
    }

    public Money getUnitPrice() {
        return Money.ofCents(unitPrice);
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    /**
     * 재고가 저재고 기준 이하인지 여부
     */
    public boolean isLowStock() {
        return stockQuantity <= lowStockThreshold;
    }

    public boolean hasStock(int quantity) {
        return stockQuantity >= quantity;
    }

    public void deactivate(LocalDateTime now) {
        this.active = false;
        this.updatedAt = now;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 비어 있을 수 없습니다");
        }
    }

    private static String normalizeBarcode(String barcode) {
        return barcode == null || barcode.isBlank() ? null : barcode.trim();
    }

    private static int resolveThreshold(Integer lowStockThreshold) {
        if (lowStockThreshold == null) {
            return ProductConstants.DEFAULT_LOW_STOCK_THRESHOLD;
        }
        if (lowStockThreshold < 0) {
            throw new IllegalArgumentException("저재고 기준은 음수가 될 수 없습니다: " + lowStockThreshold);
        }
        return lowStockThreshold;
    }
}
