package com.rockdeals.pos.presentation.pos;

import com.rockdeals.pos.application.cart.CartService;
import com.rockdeals.pos.application.checkout.CheckoutService;
import com.rockdeals.pos.presentation.pos.mapper.PosMapper;
import com.rockdeals.pos.presentation.pos.request.AddItemRequest;
import com.rockdeals.pos.presentation.pos.request.CustomerRequest;
import com.rockdeals.pos.presentation.pos.request.DiscountRequest;
import com.rockdeals.pos.presentation.pos.request.PaymentRequest;
import com.rockdeals.pos.presentation.pos.request.ScanBarcodeRequest;
import com.rockdeals.pos.presentation.pos.request.TaxRequest;
import com.rockdeals.pos.presentation.pos.request.UpdateQuantityRequest;
import com.rockdeals.pos.presentation.pos.response.CartResponse;
import com.rockdeals.pos.presentation.pos.response.CheckoutResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * PosController - Presentation 계층
 * POS 세션 장바구니와 결제 API 요청 처리
 */
@RestController
@RequestMapping("/pos/carts")
public class PosController {

    private final CartService cartService;
    private final CheckoutService checkoutService;
    private final PosMapper posMapper;

    public PosController(CartService cartService, CheckoutService checkoutService, PosMapper posMapper) {
        this.cartService = cartService;
        this.checkoutService = checkoutService;
        this.posMapper = posMapper;
    }

    /**
     * POST /pos/carts - POS 세션 시작 (빈 장바구니)
     */
    @PostMapping
    public ResponseEntity<CartResponse> openCart() {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(posMapper.toCartResponse(cartService.openCart()));
    }

    /**
     * GET /pos/carts/{cart_id} - 장바구니 조회
     */
    @GetMapping("/{cart_id}")
    public ResponseEntity<CartResponse> getCart(@PathVariable("cart_id") String cartId) {
        return ResponseEntity.ok(posMapper.toCartResponse(cartService.getCart(cartId)));
    }

    /**
     * DELETE /pos/carts/{cart_id} - POS 세션 종료
     */
    @DeleteMapping("/{cart_id}")
    public ResponseEntity<Void> closeCart(@PathVariable("cart_id") String cartId) {
        cartService.closeCart(cartId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /pos/carts/{cart_id}/items - 상품 담기 (있으면 수량 +1)
     */
    @PostMapping("/{cart_id}/items")
    public ResponseEntity<CartResponse> addItem(
            @PathVariable("cart_id") String cartId,
            @RequestBody AddItemRequest request) {
        Long productId = required(request.getProductId(), "product_id");
        return ResponseEntity.ok(posMapper.toCartResponse(cartService.addItem(cartId, productId)));
    }

    /**
     * POST /pos/carts/{cart_id}/items/scan - 바코드로 담기
     */
    @PostMapping("/{cart_id}/items/scan")
    public ResponseEntity<CartResponse> scanBarcode(
            @PathVariable("cart_id") String cartId,
            @RequestBody ScanBarcodeRequest request) {
        String barcode = required(request.getBarcode(), "barcode");
        return ResponseEntity.ok(posMapper.toCartResponse(cartService.scanBarcode(cartId, barcode)));
    }

    /**
     * PUT /pos/carts/{cart_id}/items/{product_id} - 수량 변경 (0 이하면 제거)
     */
    @PutMapping("/{cart_id}/items/{product_id}")
    public ResponseEntity<CartResponse> changeQuantity(
            @PathVariable("cart_id") String cartId,
            @PathVariable("product_id") Long productId,
            @RequestBody UpdateQuantityRequest request) {
        int quantity = required(request.getQuantity(), "quantity");
        return ResponseEntity.ok(posMapper.toCartResponse(cartService.changeQuantity(cartId, productId, quantity)));
    }

    /**
     * DELETE /pos/carts/{cart_id}/items/{product_id} - 항목 제거
     */
    @DeleteMapping("/{cart_id}/items/{product_id}")
    public ResponseEntity<CartResponse> removeItem(
            @PathVariable("cart_id") String cartId,
            @PathVariable("product_id") Long productId) {
        return ResponseEntity.ok(posMapper.toCartResponse(cartService.removeItem(cartId, productId)));
    }

    /**
     * PUT /pos/carts/{cart_id}/discount - 할인율 설정
     */
    @PutMapping("/{cart_id}/discount")
    public ResponseEntity<CartResponse> applyDiscount(
            @PathVariable("cart_id") String cartId,
            @RequestBody DiscountRequest request) {
        return ResponseEntity.ok(posMapper.toCartResponse(
                cartService.applyDiscount(cartId, request.getDiscountPercent())));
    }

    /**
     * PUT /pos/carts/{cart_id}/tax - 세율 설정
     */
    @PutMapping("/{cart_id}/tax")
    public ResponseEntity<CartResponse> changeTaxRate(
            @PathVariable("cart_id") String cartId,
            @RequestBody TaxRequest request) {
        return ResponseEntity.ok(posMapper.toCartResponse(
                cartService.changeTaxRate(cartId, required(request.getTaxPercent(), "tax_percent"))));
    }

    /**
     * PUT /pos/carts/{cart_id}/payment - 결제수단과 받은 금액 설정
     */
    @PutMapping("/{cart_id}/payment")
    public ResponseEntity<CartResponse> changePayment(
            @PathVariable("cart_id") String cartId,
            @RequestBody PaymentRequest request) {
        return ResponseEntity.ok(posMapper.toCartResponse(cartService.changePayment(
                cartId, required(request.getPaymentMethod(), "payment_method"), request.getAmountTendered())));
    }

    /**
     * PUT /pos/carts/{cart_id}/customer - 고객 지정/해제
     */
    @PutMapping("/{cart_id}/customer")
    public ResponseEntity<CartResponse> assignCustomer(
            @PathVariable("cart_id") String cartId,
            @RequestBody CustomerRequest request) {
        return ResponseEntity.ok(posMapper.toCartResponse(
                cartService.assignCustomer(cartId, request.getCustomerId())));
    }

    /**
     * POST /pos/carts/{cart_id}/clear - 장바구니 초기화
     */
    @PostMapping("/{cart_id}/clear")
    public ResponseEntity<CartResponse> clearCart(@PathVariable("cart_id") String cartId) {
        return ResponseEntity.ok(posMapper.toCartResponse(cartService.clearCart(cartId)));
    }

    /**
     * POST /pos/carts/{cart_id}/checkout - 결제
     *
     * 성공 시 201 Created, 장바구니는 비워진다.
     * 실패 시 장바구니는 그대로 남는다.
     */
    @PostMapping("/{cart_id}/checkout")
    public ResponseEntity<CheckoutResponse> checkout(@PathVariable("cart_id") String cartId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(posMapper.toCheckoutResponse(checkoutService.checkout(cartId)));
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " 값은 필수입니다");
        }
        return value;
    }
}
