package com.rockdeals.pos.domain.sale;

import com.rockdeals.pos.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

/**
 * SaleItem 도메인 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - 판매 시점의 상품명과 단가를 스냅샷으로 저장
 * - 라인 합계 = 단가 × 수량
 */
@Entity
@Table(name = "sale_items")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class SaleItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "sale_item_id")
    private Long saleItemId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;

    @Column(name = "line_total", nullable = false)
    private Long lineTotal;

    public static SaleItem from(SaleLine line) {
        return SaleItem.builder()
                .productId(line.getProductId())
                .productName(line.getProductName() == null ? "" : line.getProductName())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice().getCents())
                .lineTotal(line.getLineTotal().getCents())
                .build();
    }

    public Money unitPriceAsMoney() {
        return Money.ofCents(unitPrice);
    }

    public Money lineTotalAsMoney() {
        return Money.ofCents(lineTotal);
    }
}
