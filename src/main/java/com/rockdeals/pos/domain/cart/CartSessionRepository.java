package com.rockdeals.pos.domain.cart;

import java.util.Collection;
import java.util.Optional;

/**
 * CartSessionRepository - 열린 POS 세션의 장바구니 저장소 (Port)
 *
 * 장바구니는 단말 세션에 속하며 판매가 확정되기 전까지 영속화하지 않는다.
 */
public interface CartSessionRepository {

    Cart save(Cart cart);

    Optional<Cart> findById(String cartId);

    Collection<Cart> findAll();

    void deleteById(String cartId);
}
