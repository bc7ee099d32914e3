package com.rockdeals.pos.application.cart;

import com.rockdeals.pos.application.cart.dto.CartSummary;
import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.cart.CartNotFoundException;
import com.rockdeals.pos.domain.cart.CartSessionRepository;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.product.Product;
import com.rockdeals.pos.domain.product.ProductNotFoundException;
import com.rockdeals.pos.domain.product.ProductRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * CartService - POS 세션 장바구니 관리
 *
 * 책임:
 * - 세션 시작/종료
 * - 상품 조회(ID, 바코드) 후 장바구니에 담기
 * - 수량, 할인율, 세율, 결제수단, 받은 금액, 고객 설정
 *
 * 비즈니스 규칙은 Cart 도메인 모델이 가진다.
 * 모든 변경 메서드는 변경 후의 장바구니 요약을 반환한다.
 */
@Slf4j
@Service
public class CartService {

    private final CartSessionRepository cartSessionRepository;
    private final ProductRepository productRepository;
    private final Clock clock;
    private final BigDecimal defaultTaxPercent;

    public CartService(CartSessionRepository cartSessionRepository,
                       ProductRepository productRepository,
                       Clock clock,
                       @Value("${pos.cart.default-tax-percent:15}") BigDecimal defaultTaxPercent) {
        this.cartSessionRepository = cartSessionRepository;
        this.productRepository = productRepository;
        this.clock = clock;
        this.defaultTaxPercent = defaultTaxPercent;
    }

    // ========== 세션 ==========

    public CartSummary openCart() {
        Cart cart = cartSessionRepository.save(Cart.open(UUID.randomUUID().toString(), defaultTaxPercent, clock));
        log.info("[CartService] POS 세션 시작 - cartId={}, defaultTaxPercent={}", cart.getCartId(), defaultTaxPercent);
        return CartSummary.from(cart);
    }

    public CartSummary getCart(String cartId) {
        return CartSummary.from(findCart(cartId));
    }

    public void closeCart(String cartId) {
        findCart(cartId);
        cartSessionRepository.deleteById(cartId);
        log.info("[CartService] POS 세션 종료 - cartId={}", cartId);
    }

    // ========== 항목 ==========

    /**
     * 상품 ID로 담기
     *
     * @throws ProductNotFoundException 상품이 없는 경우
     */
    public CartSummary addItem(String cartId, Long productId) {
        Cart cart = findCart(cartId);
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        cart.addItem(product);
        return CartSummary.from(cart);
    }

    /**
     * 바코드 스캔으로 담기
     *
     * @throws ProductNotFoundException 바코드에 해당하는 상품이 없는 경우
     */
    public CartSummary scanBarcode(String cartId, String barcode) {
        Cart cart = findCart(cartId);
        Product product = productRepository.findByBarcode(barcode)
                .orElseThrow(() -> new ProductNotFoundException(barcode));
        cart.addItem(product);
        return CartSummary.from(cart);
    }

    public CartSummary changeQuantity(String cartId, Long productId, int quantity) {
        Cart cart = findCart(cartId);
        cart.setQuantity(productId, quantity);
        return CartSummary.from(cart);
    }

    public CartSummary removeItem(String cartId, Long productId) {
        Cart cart = findCart(cartId);
        cart.removeItem(productId);
        return CartSummary.from(cart);
    }

    // ========== 판매 조건 ==========

    public CartSummary applyDiscount(String cartId, BigDecimal discountPercent) {
        Cart cart = findCart(cartId);
        cart.setDiscountPercent(discountPercent);
        return CartSummary.from(cart);
    }

    public CartSummary changeTaxRate(String cartId, BigDecimal taxPercent) {
        Cart cart = findCart(cartId);
        cart.setTaxPercent(taxPercent);
        return CartSummary.from(cart);
    }

    /**
     * 결제수단과 받은 금액 설정
     * 카드 결제로 바꾸면 받은 금액은 지운다.
     */
    public CartSummary changePayment(String cartId, PaymentMethod paymentMethod, BigDecimal amountTendered) {
        Cart cart = findCart(cartId);
        cart.setPaymentMethod(paymentMethod);
        cart.setAmountTendered(paymentMethod.isCash() ? amountTendered : null);
        return CartSummary.from(cart);
    }

    public CartSummary assignCustomer(String cartId, Long customerId) {
        Cart cart = findCart(cartId);
        cart.setCustomer(customerId);
        return CartSummary.from(cart);
    }

    public CartSummary clearCart(String cartId) {
        Cart cart = findCart(cartId);
        cart.clear();
        return CartSummary.from(cart);
    }

    private Cart findCart(String cartId) {
        return cartSessionRepository.findById(cartId)
                .orElseThrow(() -> new CartNotFoundException(cartId));
    }
}
