package com.rockdeals.pos.domain.cart;

import com.rockdeals.pos.domain.common.vo.Money;
import com.rockdeals.pos.domain.product.Product;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cart 도메인 모델 (Rich Domain Model)
 *
 * 책임:
 * - POS 세션 하나의 진행 중인 판매를 보관
 * - 항목 추가/수량 변경/삭제, 할인율/세율/결제수단/받은 금액/고객 설정
 * - 소계, 할인액, 과세표준, 세액, 합계, 거스름돈을 현재 상태로부터 계산
 * - 결제 시도 상태(CheckoutState) 관리
 *
 * 핵심 비즈니스 규칙:
 * - 항목 순서 = 담은 순서 = 화면 표시 순서
 * - 파생 금액은 저장하지 않고 항상 현재 항목/설정으로 다시 계산
 * - 세금은 할인 후 금액에 부과
 * - 할인율은 [0, 100] 범위로 보정 (거절하지 않음)
 * - 세율은 [0, 100], 받은 금액은 [0, MAX_AMOUNT_TENDERED] 범위가 아니면 저장 전에 거절
 * - 결제가 진행 중인 동안에는 장바구니를 변경할 수 없음
 *
 * 동시성:
 * - 한 세션의 장바구니는 운영자 한 명만 변경하므로 항목에는 락이 없음
 * - 결제 상태만 AtomicReference로 관리해 중복 결제 요청을 막음
 */
@Getter
public class Cart {

    private final String cartId;
    private final BigDecimal defaultTaxPercent;
    private final LocalDateTime openedAt;

    @Getter(lombok.AccessLevel.NONE)
    private final Clock clock;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<Long, LineItem> items = new LinkedHashMap<>();

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<CheckoutState> checkoutState = new AtomicReference<>(CheckoutState.IDLE);

    private BigDecimal discountPercent;
    private BigDecimal taxPercent;
    private PaymentMethod paymentMethod;
    private Money amountTendered;
    private Long customerId;
    private LocalDateTime lastActivityAt;

    private Cart(String cartId, BigDecimal defaultTaxPercent, Clock clock) {
        this.cartId = Objects.requireNonNull(cartId, "cartId는 null이 될 수 없습니다");
        this.clock = Objects.requireNonNull(clock, "clock은 null이 될 수 없습니다");
        this.defaultTaxPercent = validateTaxPercent(defaultTaxPercent);
        this.openedAt = LocalDateTime.now(clock);
        this.lastActivityAt = openedAt;
        resetModifiers();
    }

    /**
     * 빈 장바구니 생성 (세션 시작)
     *
     * @param cartId 세션 식별자
     * @param defaultTaxPercent clear() 시 복원되는 기본 세율
     * @param clock 세션 시작/마지막 변경 시각 기준
     */
    public static Cart open(String cartId, BigDecimal defaultTaxPercent, Clock clock) {
        return new Cart(cartId, defaultTaxPercent, clock);
    }

    // ========== 항목 변경 ==========

    /**
     * 상품 담기
     *
     * 비즈니스 규칙:
     * - 이미 있는 상품이면 수량 +1
     * - 없으면 수량 1로 맨 뒤에 추가, 단가와 재고를 스냅샷
     * - 재고 검증은 하지 않음 (판매 확정 시 저장소가 검증)
     */
    public LineItem addItem(Product product) {
        Objects.requireNonNull(product, "product는 null이 될 수 없습니다");
        ensureEditable();
        LineItem existing = items.get(product.getProductId());
        if (existing != null) {
            existing.increase();
            return existing;
        }
        LineItem lineItem = new LineItem(
                product.getProductId(),
                product.getName(),
                product.getUnitPrice(),
                product.getStockQuantity() == null ? 0 : product.getStockQuantity()
        );
        items.put(lineItem.getProductId(), lineItem);
        return lineItem;
    }

    /**
     * 수량 변경
     * - newQuantity <= 0 이면 항목 제거
     * - 없는 상품이면 아무 것도 하지 않음
     */
    public void setQuantity(Long productId, int newQuantity) {
        ensureEditable();
        LineItem lineItem = items.get(productId);
        if (lineItem == null) {
            return;
        }
        if (newQuantity < CartConstants.MIN_LINE_QUANTITY) {
            items.remove(productId);
            return;
        }
        lineItem.changeQuantity(newQuantity);
    }

    public void removeItem(Long productId) {
        ensureEditable();
        items.remove(productId);
    }

    // ========== 판매 조건 설정 ==========

    /**
     * 할인율 설정. 범위를 벗어나면 0 또는 100으로 보정한다. null은 0.
     */
    public void setDiscountPercent(BigDecimal value) {
        ensureEditable();
        this.discountPercent = clampDiscount(value);
    }

    /**
     * 세율 설정. [0, 100] 밖이면 InvalidTaxRateException, 기존 세율은 유지된다.
     */
    public void setTaxPercent(BigDecimal value) {
        ensureEditable();
        this.taxPercent = validateTaxPercent(value);
    }

    public void setPaymentMethod(PaymentMethod method) {
        ensureEditable();
        this.paymentMethod = Objects.requireNonNull(method, "paymentMethod는 null이 될 수 없습니다");
    }

    /**
     * 받은 금액 설정. null은 미입력.
     * 음수이거나 MAX_AMOUNT_TENDERED를 넘으면 InvalidAmountException, 기존 값은 유지된다.
     */
    public void setAmountTendered(BigDecimal value) {
        ensureEditable();
        if (value == null) {
            this.amountTendered = null;
            return;
        }
        if (value.signum() < 0 || value.compareTo(CartConstants.MAX_AMOUNT_TENDERED) > 0) {
            throw new InvalidAmountException(value);
        }
        this.amountTendered = Money.of(value);
    }

    public void setCustomer(Long customerId) {
        ensureEditable();
        this.customerId = customerId;
    }

    /**
     * 장바구니 초기화
     * 항목 삭제, 할인 0, 세율 기본값, 결제수단 CASH, 받은 금액/고객 해제
     */
    public void clear() {
        ensureEditable();
        reset();
    }

    // ========== 파생 값 ==========

    public List<LineItem> getItems() {
        return Collections.unmodifiableList(new ArrayList<>(items.values()));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int getItemCount() {
        return items.size();
    }

    public int getTotalQuantity() {
        return items.values().stream()
                .mapToInt(LineItem::getQuantity)
                .sum();
    }

    public Money getSubtotal() {
        Money subtotal = Money.ZERO;
        for (LineItem lineItem : items.values()) {
            subtotal = subtotal.add(lineItem.getLineTotal());
        }
        return subtotal;
    }

    public Money getDiscountAmount() {
        return getSubtotal().percentage(discountPercent);
    }

    public Money getTaxableBase() {
        return getSubtotal().subtract(getDiscountAmount());
    }

    public Money getTaxAmount() {
        return getTaxableBase().percentage(taxPercent);
    }

    public Money getTotal() {
        Money taxableBase = getTaxableBase();
        return taxableBase.add(taxableBase.percentage(taxPercent));
    }

    /**
     * 거스름돈 = max(0, 받은 금액 - 합계)
     * 카드 결제이거나 받은 금액이 없으면 0
     */
    public Money getChangeDue() {
        if (!paymentMethod.isCash() || amountTendered == null) {
            return Money.ZERO;
        }
        return amountTendered.subtractOrZero(getTotal());
    }

    /**
     * 현금 결제 시 부족 금액 = max(0, 합계 - 받은 금액)
     * 카드 결제는 항상 0
     */
    public Money getShortfall() {
        if (!paymentMethod.isCash()) {
            return Money.ZERO;
        }
        Money tendered = amountTendered == null ? Money.ZERO : amountTendered;
        return getTotal().subtractOrZero(tendered);
    }

    // ========== 결제 상태 ==========

    public CheckoutState getCheckoutState() {
        return checkoutState.get();
    }

    /**
     * 결제 시도 시작 (IDLE → VALIDATING)
     *
     * @throws SubmissionInProgressException 이미 결제가 진행 중인 경우
     */
    public void beginCheckout() {
        if (!checkoutState.compareAndSet(CheckoutState.IDLE, CheckoutState.VALIDATING)) {
            throw new SubmissionInProgressException(cartId);
        }
        touch();
    }

    /**
     * 검증 통과 후 저장소 호출 직전 (VALIDATING → SUBMITTING)
     */
    public void markSubmitting() {
        if (!checkoutState.compareAndSet(CheckoutState.VALIDATING, CheckoutState.SUBMITTING)) {
            throw new IllegalStateException("검증 단계가 아닌 결제는 제출할 수 없습니다: " + checkoutState.get());
        }
    }

    /**
     * 판매 확정 (SUBMITTING → IDLE), 장바구니를 비운다
     */
    public void completeCheckout() {
        if (checkoutState.get() != CheckoutState.SUBMITTING) {
            throw new IllegalStateException("제출 중이 아닌 결제는 확정할 수 없습니다: " + checkoutState.get());
        }
        reset();
        checkoutState.set(CheckoutState.IDLE);
    }

    /**
     * 결제 거절, 장바구니는 그대로 두고 IDLE로 복귀
     */
    public void abortCheckout() {
        checkoutState.set(CheckoutState.IDLE);
    }

    // ========== 세션 만료 ==========

    /**
     * 결제 중이 아니고 마지막 변경이 cutoff 이전이면 true
     */
    public boolean isIdleSince(LocalDateTime cutoff) {
        return !checkoutState.get().isInFlight() && lastActivityAt.isBefore(cutoff);
    }

    // ========== 내부 ==========

    private void ensureEditable() {
        if (checkoutState.get().isInFlight()) {
            throw new SubmissionInProgressException(cartId);
        }
        touch();
    }

    private void touch() {
        this.lastActivityAt = LocalDateTime.now(clock);
    }

    private static BigDecimal validateTaxPercent(BigDecimal value) {
        if (value == null
                || value.signum() < 0
                || value.compareTo(CartConstants.MAX_TAX_PERCENT) > 0) {
            throw new InvalidTaxRateException(value);
        }
        return value;
    }

    private void reset() {
        items.clear();
        resetModifiers();
    }

    private void resetModifiers() {
        this.discountPercent = CartConstants.MIN_DISCOUNT_PERCENT;
        this.taxPercent = defaultTaxPercent;
        this.paymentMethod = PaymentMethod.CASH;
        this.amountTendered = null;
        this.customerId = null;
    }

    private static BigDecimal clampDiscount(BigDecimal value) {
        if (value == null || value.compareTo(CartConstants.MIN_DISCOUNT_PERCENT) < 0) {
            return CartConstants.MIN_DISCOUNT_PERCENT;
        }
        if (value.compareTo(CartConstants.MAX_DISCOUNT_PERCENT) > 0) {
            return CartConstants.MAX_DISCOUNT_PERCENT;
        }
        return value;
    }
}
