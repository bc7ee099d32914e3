package com.rockdeals.pos.infrastructure.session;

import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.cart.CartSessionRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-Memory 기반 CartSessionRepository 구현
 *
 * POS 단말 세션의 장바구니를 프로세스 메모리에 보관한다.
 * 판매가 확정되기 전의 장바구니는 영속화 대상이 아니다.
 */
@Repository
public class InMemoryCartSessionRepository implements CartSessionRepository {

    private final Map<String, Cart> carts = new ConcurrentHashMap<>();

    @Override
    public Cart save(Cart cart) {
        carts.put(cart.getCartId(), cart);
        return cart;
    }

    @Override
    public Optional<Cart> findById(String cartId) {
        if (cartId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(carts.get(cartId));
    }

    @Override
    public Collection<Cart> findAll() {
        return new ArrayList<>(carts.values());
    }

    @Override
    public void deleteById(String cartId) {
        if (cartId != null) {
            carts.remove(cartId);
        }
    }
}
