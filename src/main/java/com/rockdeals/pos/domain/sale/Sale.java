package com.rockdeals.pos.domain.sale;

import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Sale 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 확정된 판매의 금액 스냅샷과 항목 보관
 * - 영수증 조회의 원천
 * - 환불 상태 전환 (COMPLETED → REFUNDED)
 *
 * 핵심 비즈니스 규칙:
 * - 판매는 최소 1개 이상의 항목을 가진다
 * - 금액은 센트 단위 정수
 * - 받은 금액/거스름돈은 현금 결제에서만 기록
 * - 환불은 판매 전체 단위로 한 번만 가능, 환불 금액 = 판매 합계
 */
@Entity
@Table(name = "sales", uniqueConstraints = {
    @UniqueConstraint(columnNames = "receipt_number")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Sale {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "sale_id")
    private Long saleId;

    @Column(name = "receipt_number", nullable = false, length = 32)
    private String receiptNumber;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "subtotal", nullable = false)
    private Long subtotal;

    @Column(name = "discount_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercent;

    @Column(name = "discount_amount", nullable = false)
    private Long discountAmount;

    @Column(name = "tax_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal taxPercent;

    @Column(name = "tax_amount", nullable = false)
    private Long taxAmount;

    @Column(name = "total_amount", nullable = false)
    private Long totalAmount;

    @Column(name = "payment_method", nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(name = "amount_tendered")
    private Long amountTendered;

    @Column(name = "change_due", nullable = false)
    private Long changeDue;

    @Column(name = "status", nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private SaleStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "refund_amount")
    private Long refundAmount;

    @Column(name = "refund_reason")
    private String refundReason;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    /**
     * 판매 항목
     * 판매와 항목은 함께 저장되고 함께 조회된다.
     */
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @JoinColumn(name = "sale_id", nullable = false)
    @Builder.Default
    private List<SaleItem> items = new ArrayList<>();

    /**
     * 판매 생성 팩토리 메서드
     *
     * @param request 장바구니 스냅샷
     * @param receiptNumber 발급된 영수증 번호
     * @param createdAt 판매 시각
     */
    public static Sale create(SaleRequest request, String receiptNumber, LocalDateTime createdAt) {
        if (request.getLines().isEmpty()) {
            throw new IllegalArgumentException("판매는 최소 1개 이상의 항목이 필요합니다");
        }
        Sale sale = Sale.builder()
                .receiptNumber(receiptNumber)
                .customerId(request.getCustomerId())
                .subtotal(request.getSubtotal().getCents())
                .discountPercent(request.getDiscountPercent())
                .discountAmount(request.getDiscountAmount().getCents())
                .taxPercent(request.getTaxPercent())
                .taxAmount(request.getTaxAmount().getCents())
                .totalAmount(request.getTotalAmount().getCents())
                .paymentMethod(request.getPaymentMethod())
                .amountTendered(request.getAmountTendered() == null ? null : request.getAmountTendered().getCents())
                .changeDue(request.getChangeDue().getCents())
                .status(request.getStatus())
                .createdAt(createdAt)
                .build();
        request.getLines().forEach(line -> sale.items.add(SaleItem.from(line)));
        return sale;
    }

    /**
     * 판매 환불
     *
     * @param reason 환불 사유 (선택)
     * @param refundedAt 환불 시각
     * @throws SaleAlreadyRefundedException 이미 환불된 판매
     */
    public void refund(String reason, LocalDateTime refundedAt) {
        if (isRefunded()) {
            throw new SaleAlreadyRefundedException(saleId);
        }
        this.status = SaleStatus.REFUNDED;
        this.refundAmount = totalAmount;
        this.refundReason = reason;
        this.refundedAt = refundedAt;
    }

    public boolean isRefunded() {
        return status == SaleStatus.REFUNDED;
    }

    public Money totalAsMoney() {
        return Money.ofCents(totalAmount);
    }

    public int getTotalQuantity() {
        return items.stream()
                .mapToInt(SaleItem::getQuantity)
                .sum();
    }
}
