package com.rockdeals.pos.application.cart;

import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.cart.CartSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * CartSessionExpiryService - 유휴 POS 세션 정리
 *
 * 단말이 세션을 닫지 않고 떠나면 장바구니가 메모리에 남는다.
 * 마지막 변경 후 pos.cart.session-idle-minutes 가 지난 세션을 주기적으로 제거한다.
 *
 * 비즈니스 규칙:
 * - 결제가 진행 중인 장바구니는 제거하지 않음
 * - 제거된 세션에 접근하면 CartNotFoundException (단말이 새 세션을 연다)
 */
@Slf4j
@Service
public class CartSessionExpiryService {

    private final CartSessionRepository cartSessionRepository;
    private final Clock clock;
    private final long idleMinutes;

    public CartSessionExpiryService(CartSessionRepository cartSessionRepository,
                                    Clock clock,
                                    @Value("${pos.cart.session-idle-minutes:120}") long idleMinutes) {
        this.cartSessionRepository = cartSessionRepository;
        this.clock = clock;
        this.idleMinutes = idleMinutes;
    }

    /**
     * 유휴 세션 제거
     *
     * @return 제거한 세션 수
     */
    @Scheduled(fixedDelayString = "${pos.cart.session-sweep-interval-ms:60000}")
    public int expireIdleSessions() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(idleMinutes);
        int expired = 0;
        for (Cart cart : cartSessionRepository.findAll()) {
            if (cart.isIdleSince(cutoff)) {
                cartSessionRepository.deleteById(cart.getCartId());
                expired++;
                log.info("[CartSessionExpiryService] 유휴 세션 만료 - cartId={}, lastActivityAt={}",
                        cart.getCartId(), cart.getLastActivityAt());
            }
        }
        if (expired > 0) {
            log.info("[CartSessionExpiryService] 유휴 세션 정리 완료 - expired={}, cutoff={}", expired, cutoff);
        }
        return expired;
    }
}
