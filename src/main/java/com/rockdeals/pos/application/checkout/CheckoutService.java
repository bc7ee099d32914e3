package com.rockdeals.pos.application.checkout;

import com.rockdeals.pos.application.checkout.dto.CheckoutResult;
import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.cart.CartNotFoundException;
import com.rockdeals.pos.domain.cart.CartSessionRepository;
import com.rockdeals.pos.domain.common.vo.Money;
import com.rockdeals.pos.domain.sale.SaleReceipt;
import com.rockdeals.pos.domain.sale.SaleRequest;
import com.rockdeals.pos.domain.sale.SaleStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * CheckoutService - 결제 제출기
 *
 * 책임:
 * - 장바구니를 검증하고 SaleRequest 스냅샷으로 변환
 * - 판매 저장소를 정확히 한 번 호출
 * - 성공 시 장바구니를 비우고 판매 ID, 영수증 번호, 거스름돈 반환
 *
 * 상태 전환 (결제 시도 단위):
 * IDLE → VALIDATING → SUBMITTING → 확정(장바구니 초기화) | 거절(장바구니 유지)
 *
 * 비즈니스 규칙:
 * - 같은 장바구니에 진행 중인 결제가 있으면 SubmissionInProgressException
 * - 실패 시 예외를 그대로 전달하고 장바구니는 건드리지 않음
 * - 확정되지 않은 모든 종료(RuntimeException, Error 포함)는 IDLE로 복귀
 * - 자동 재시도 없음 (운영자가 수정 후 다시 결제)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private final CheckoutValidator checkoutValidator;
    private final SaleStorage saleStorage;
    private final CartSessionRepository cartSessionRepository;

    /**
     * 세션 장바구니 결제
     *
     * @throws CartNotFoundException 세션이 없는 경우
     */
    public CheckoutResult checkout(String cartId) {
        Cart cart = cartSessionRepository.findById(cartId)
                .orElseThrow(() -> new CartNotFoundException(cartId));
        return submit(cart);
    }

    /**
     * 장바구니 결제 제출
     *
     * @param cart 결제할 장바구니
     * @return 판매 ID, 영수증 번호, 합계, 결제수단, 거스름돈
     */
    public CheckoutResult submit(Cart cart) {
        cart.beginCheckout();

        boolean committed = false;
        try {
            checkoutValidator.validate(cart);

            SaleRequest request = SaleRequest.from(cart);
            Money changeDue = request.getChangeDue();
            cart.markSubmitting();

            SaleReceipt receipt = saleStorage.createSale(request);
            cart.completeCheckout();
            committed = true;

            log.info("[CheckoutService] 결제 확정 - cartId={}, saleId={}, receiptNumber={}, total={}, method={}",
                    cart.getCartId(), receipt.getSaleId(), receipt.getReceiptNumber(),
                    request.getTotalAmount(), request.getPaymentMethod());

            return new CheckoutResult(
                    receipt.getSaleId(),
                    receipt.getReceiptNumber(),
                    request.getTotalAmount(),
                    request.getPaymentMethod(),
                    changeDue
            );
        } catch (RuntimeException e) {
            log.warn("[CheckoutService] 결제 거절 - cartId={}, reason={}", cart.getCartId(), e.getMessage());
            throw e;
        } finally {
            if (!committed) {
                cart.abortCheckout();
            }
        }
    }
}
