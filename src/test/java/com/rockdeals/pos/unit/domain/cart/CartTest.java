package com.rockdeals.pos.unit.domain.cart;

import com.rockdeals.pos.config.TestDataFactory;
import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.cart.CheckoutState;
import com.rockdeals.pos.domain.cart.InvalidAmountException;
import com.rockdeals.pos.domain.cart.InvalidTaxRateException;
import com.rockdeals.pos.domain.cart.LineItem;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.cart.SubmissionInProgressException;
import com.rockdeals.pos.domain.common.vo.Money;
import com.rockdeals.pos.domain.product.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CartTest - Cart 도메인 모델 단위 테스트
 *
 * 테스트 대상:
 * - 항목 추가/수량 변경/삭제
 * - 할인율 보정, 세율/받은 금액 검증
 * - 소계/할인/세금/합계/거스름돈 계산
 * - 결제 상태 전환
 */
@DisplayName("Cart 도메인 모델 테스트")
class CartTest {

    private Cart cart;
    private Product mouse;
    private Product keyboard;
    private Product cable;

    @BeforeEach
    void setup() {
        cart = TestDataFactory.emptyCart("cart-1");
        mouse = TestDataFactory.product(1L, "Wireless Mouse", "29.99", 10);
        keyboard = TestDataFactory.product(2L, "Keyboard", "49.50", 1);
        cable = TestDataFactory.product(3L, "USB Cable", "5.25", 0);
    }

    // ========== 항목 변경 ==========

    @Test
    @DisplayName("같은 상품을 다시 담으면 수량이 1 증가한다")
    void testAddItem_SameProduct_IncrementsQuantity() {
        cart.addItem(mouse);
        LineItem line = cart.addItem(mouse);

        assertEquals(1, cart.getItemCount());
        assertEquals(2, line.getQuantity());
    }

    @Test
    @DisplayName("항목 순서는 처음 담은 순서를 유지한다")
    void testAddItem_KeepsInsertionOrder() {
        cart.addItem(keyboard);
        cart.addItem(mouse);
        cart.addItem(keyboard);

        List<Long> ids = cart.getItems().stream().map(LineItem::getProductId).collect(Collectors.toList());
        assertEquals(List.of(2L, 1L), ids);
    }

    @Test
    @DisplayName("재고 0인 상품도 담을 수 있고 재고 초과 안내만 표시된다")
    void testAddItem_NoStockCheck() {
        LineItem line = cart.addItem(cable);

        assertEquals(1, line.getQuantity());
        assertTrue(line.isStockExceeded());
        assertFalse(line.canAddMore());
    }

    @Test
    @DisplayName("담은 시점의 단가와 재고가 스냅샷된다")
    void testAddItem_SnapshotsPriceAndStock() {
        LineItem line = cart.addItem(keyboard);

        assertEquals(Money.of("49.50"), line.getUnitPrice());
        assertEquals(1, line.getAvailableStock());
        assertFalse(line.canAddMore());
    }

    @Test
    @DisplayName("수량을 0 이하로 바꾸면 항목이 제거된다")
    void testSetQuantity_ZeroOrNegative_RemovesItem() {
        cart.addItem(mouse);
        cart.addItem(keyboard);

        cart.setQuantity(1L, 0);
        cart.setQuantity(2L, -3);

        assertTrue(cart.isEmpty());
    }

    @Test
    @DisplayName("없는 상품의 수량 변경과 삭제는 아무 것도 하지 않는다")
    void testSetQuantityAndRemove_UnknownProduct_NoOp() {
        cart.addItem(mouse);

        cart.setQuantity(99L, 5);
        cart.removeItem(99L);

        assertEquals(1, cart.getItemCount());
        assertEquals(1, cart.getTotalQuantity());
    }

    // ========== 판매 조건 ==========

    @Test
    @DisplayName("할인율은 0~100 범위로 보정된다 (-5 → 0, 150 → 100)")
    void testSetDiscountPercent_Clamped() {
        cart.setDiscountPercent(BigDecimal.valueOf(-5));
        assertEquals(0, cart.getDiscountPercent().compareTo(BigDecimal.ZERO));

        cart.setDiscountPercent(BigDecimal.valueOf(150));
        assertEquals(0, cart.getDiscountPercent().compareTo(BigDecimal.valueOf(100)));

        cart.setDiscountPercent(null);
        assertEquals(0, cart.getDiscountPercent().compareTo(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("음수 세율과 음수 받은 금액은 데이터 모델 불변식 위반으로 거절된다")
    void testNegativeTaxAndTender_Rejected() {
        InvalidTaxRateException taxException = assertThrows(InvalidTaxRateException.class,
                () -> cart.setTaxPercent(BigDecimal.valueOf(-1)));
        InvalidAmountException amountException = assertThrows(InvalidAmountException.class,
                () -> cart.setAmountTendered(new BigDecimal("-0.01")));

        assertTrue(taxException.getMessage().contains("데이터 모델 불변식"));
        assertTrue(amountException.getMessage().contains("데이터 모델 불변식"));
        assertEquals(0, cart.getTaxPercent().compareTo(TestDataFactory.DEFAULT_TAX));
    }

    @Test
    @DisplayName("상한을 넘는 세율은 저장 전에 거절되고 합계는 계속 계산된다")
    void testTaxPercent_AboveMaximum_RejectedBeforeStore() {
        cart.addItem(mouse);
        cart.addItem(mouse);

        assertThrows(InvalidTaxRateException.class, () -> cart.setTaxPercent(new BigDecimal("1E30")));
        assertThrows(InvalidTaxRateException.class, () -> cart.setTaxPercent(new BigDecimal("100.01")));

        assertEquals(0, cart.getTaxPercent().compareTo(TestDataFactory.DEFAULT_TAX));
        assertEquals(Money.of("68.98"), cart.getTotal());

        cart.setTaxPercent(BigDecimal.valueOf(100));
        assertEquals(Money.of("119.96"), cart.getTotal());
    }

    @Test
    @DisplayName("상한을 넘는 받은 금액은 InvalidAmountException, 기존 값 유지")
    void testAmountTendered_AboveMaximum_Rejected() {
        cart.addItem(mouse);
        cart.setAmountTendered(new BigDecimal("70.00"));

        assertThrows(InvalidAmountException.class, () -> cart.setAmountTendered(new BigDecimal("1E20")));
        assertThrows(InvalidAmountException.class, () -> cart.setAmountTendered(new BigDecimal("10000000.01")));

        assertEquals(Money.of("70.00"), cart.getAmountTendered());

        cart.setAmountTendered(new BigDecimal("10000000.00"));
        assertEquals(Money.of("10000000.00"), cart.getAmountTendered());
    }

    // ========== 세션 시각 ==========

    @Test
    @DisplayName("세션 시작 시각과 마지막 변경 시각은 주입된 Clock을 따른다")
    void testOpenedAt_UsesClock() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T09:00:00Z"), ZoneOffset.UTC);
        Cart fixed = TestDataFactory.emptyCart("cart-clock", clock);

        assertEquals(LocalDateTime.of(2026, 10, 19, 9, 0), fixed.getOpenedAt());
        assertEquals(fixed.getOpenedAt(), fixed.getLastActivityAt());
        assertTrue(fixed.isIdleSince(LocalDateTime.of(2026, 10, 19, 9, 1)));
        assertFalse(fixed.isIdleSince(LocalDateTime.of(2026, 10, 19, 9, 0)));
    }

    @Test
    @DisplayName("결제 중인 장바구니는 유휴 상태로 보지 않는다")
    void testIsIdleSince_InFlight_False() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T09:00:00Z"), ZoneId.of("UTC"));
        Cart fixed = TestDataFactory.emptyCart("cart-inflight", clock);
        fixed.beginCheckout();

        assertFalse(fixed.isIdleSince(LocalDateTime.of(2026, 10, 20, 9, 0)));
    }

    // ========== 파생 값 ==========

    @Test
    @DisplayName("29.99 × 2, 세금 15% → 소계 59.98, 세금 9.00, 합계 68.98")
    void testTotals_Scenario() {
        cart.addItem(mouse);
        cart.addItem(mouse);

        assertEquals(Money.of("59.98"), cart.getSubtotal());
        assertEquals(Money.ZERO, cart.getDiscountAmount());
        assertEquals(Money.of("9.00"), cart.getTaxAmount());
        assertEquals(Money.of("68.98"), cart.getTotal());
    }

    @Test
    @DisplayName("세금은 할인 후 금액에 부과된다")
    void testTotals_TaxOnDiscountedBase() {
        cart.addItem(keyboard);                      // 49.50
        cart.setDiscountPercent(BigDecimal.TEN);     // 4.95
        cart.setTaxPercent(BigDecimal.valueOf(20));  // (49.50 - 4.95) × 20% = 8.91

        assertEquals(Money.of("4.95"), cart.getDiscountAmount());
        assertEquals(Money.of("44.55"), cart.getTaxableBase());
        assertEquals(Money.of("8.91"), cart.getTaxAmount());
        assertEquals(Money.of("53.46"), cart.getTotal());
    }

    @Test
    @DisplayName("현금 70.00을 받으면 거스름돈은 1.02")
    void testChangeDue_Cash() {
        cart.addItem(mouse);
        cart.addItem(mouse);
        cart.setAmountTendered(new BigDecimal("70.00"));

        assertEquals(Money.of("1.02"), cart.getChangeDue());
        assertEquals(Money.ZERO, cart.getShortfall());
    }

    @Test
    @DisplayName("받은 금액이 부족하면 거스름돈은 0, 부족 금액은 8.98")
    void testChangeDue_Insufficient() {
        cart.addItem(mouse);
        cart.addItem(mouse);
        cart.setAmountTendered(new BigDecimal("60.00"));

        assertEquals(Money.ZERO, cart.getChangeDue());
        assertEquals(Money.of("8.98"), cart.getShortfall());
    }

    @Test
    @DisplayName("카드 결제는 거스름돈을 계산하지 않는다")
    void testChangeDue_Card() {
        cart.addItem(mouse);
        cart.setAmountTendered(new BigDecimal("100.00"));
        cart.setPaymentMethod(PaymentMethod.CARD);

        assertEquals(Money.ZERO, cart.getChangeDue());
        assertEquals(Money.ZERO, cart.getShortfall());
    }

    @Test
    @DisplayName("소계는 같은 최종 항목이면 연산 순서와 무관하다")
    void testSubtotal_OrderIndependent() {
        Cart other = TestDataFactory.emptyCart("cart-2");

        cart.addItem(mouse);
        cart.addItem(keyboard);
        cart.addItem(mouse);
        cart.setQuantity(2L, 3);
        cart.addItem(cable);
        cart.removeItem(3L);

        other.addItem(keyboard);
        other.setQuantity(2L, 3);
        other.addItem(cable);
        other.addItem(mouse);
        other.setQuantity(3L, 0);
        other.setQuantity(1L, 2);

        Money expected = Money.of("29.99").multiply(2).add(Money.of("49.50").multiply(3));
        assertEquals(expected, cart.getSubtotal());
        assertEquals(expected, other.getSubtotal());
    }

    @Test
    @DisplayName("합계는 세율에 대해 증가, 할인율에 대해 감소한다")
    void testTotal_Monotonic() {
        cart.addItem(mouse);
        cart.addItem(keyboard);
        cart.addItem(cable);

        Money previous = null;
        for (int tax = 0; tax <= 30; tax += 3) {
            cart.setTaxPercent(BigDecimal.valueOf(tax));
            Money total = cart.getTotal();
            if (previous != null) {
                assertTrue(total.isGreaterThanOrEqual(previous), "tax=" + tax);
            }
            previous = total;
        }

        cart.setTaxPercent(BigDecimal.valueOf(15));
        previous = null;
        for (int discount = 0; discount <= 100; discount += 7) {
            cart.setDiscountPercent(BigDecimal.valueOf(discount));
            Money total = cart.getTotal();
            if (previous != null) {
                assertFalse(total.isGreaterThan(previous), "discount=" + discount);
            }
            previous = total;
        }
    }

    @Test
    @DisplayName("clear 후 모든 파생 값은 0, 설정은 기본값으로 복원된다")
    void testClear_ResetsToDefaults() {
        cart.addItem(mouse);
        cart.setDiscountPercent(BigDecimal.TEN);
        cart.setTaxPercent(BigDecimal.ONE);
        cart.setPaymentMethod(PaymentMethod.CARD);
        cart.setAmountTendered(BigDecimal.TEN);
        cart.setCustomer(7L);

        cart.clear();

        assertTrue(cart.isEmpty());
        assertEquals(Money.ZERO, cart.getSubtotal());
        assertEquals(Money.ZERO, cart.getDiscountAmount());
        assertEquals(Money.ZERO, cart.getTaxAmount());
        assertEquals(Money.ZERO, cart.getTotal());
        assertEquals(0, cart.getTaxPercent().compareTo(TestDataFactory.DEFAULT_TAX));
        assertEquals(PaymentMethod.CASH, cart.getPaymentMethod());
        assertNull(cart.getAmountTendered());
        assertNull(cart.getCustomerId());
    }

    // ========== 결제 상태 ==========

    @Test
    @DisplayName("결제 진행 중에는 두 번째 결제 시작과 장바구니 변경이 거절된다")
    void testCheckoutInFlight_RejectsSecondBeginAndMutations() {
        cart.addItem(mouse);
        cart.beginCheckout();

        assertEquals(CheckoutState.VALIDATING, cart.getCheckoutState());
        assertThrows(SubmissionInProgressException.class, () -> cart.beginCheckout());
        assertThrows(SubmissionInProgressException.class, () -> cart.addItem(keyboard));
        assertThrows(SubmissionInProgressException.class, () -> cart.clear());
    }

    @Test
    @DisplayName("결제 확정 시 장바구니가 비워지고 IDLE로 돌아간다")
    void testCompleteCheckout_ClearsCart() {
        cart.addItem(mouse);
        cart.beginCheckout();
        cart.markSubmitting();

        cart.completeCheckout();

        assertTrue(cart.isEmpty());
        assertEquals(CheckoutState.IDLE, cart.getCheckoutState());
    }

    @Test
    @DisplayName("결제 거절 시 장바구니는 유지되고 IDLE로 돌아간다")
    void testAbortCheckout_KeepsCart() {
        cart.addItem(mouse);
        cart.beginCheckout();
        cart.markSubmitting();

        cart.abortCheckout();

        assertEquals(1, cart.getItemCount());
        assertEquals(CheckoutState.IDLE, cart.getCheckoutState());
        cart.addItem(mouse);
        assertEquals(2, cart.getTotalQuantity());
    }
}
