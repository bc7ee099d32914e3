package com.rockdeals.pos.infrastructure.session;

import com.rockdeals.pos.config.TestDataFactory;
import com.rockdeals.pos.domain.cart.Cart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCartSessionRepository 테스트")
class InMemoryCartSessionRepositoryTest {

    private InMemoryCartSessionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCartSessionRepository();
    }

    @Test
    @DisplayName("저장한 장바구니는 같은 인스턴스로 조회된다")
    void testSaveAndFind() {
        Cart cart = TestDataFactory.emptyCart("cart-a");

        repository.save(cart);

        assertSame(cart, repository.findById("cart-a").orElseThrow());
        assertEquals(1, repository.findAll().size());
    }

    @Test
    @DisplayName("삭제 후에는 조회되지 않는다")
    void testDelete() {
        repository.save(TestDataFactory.emptyCart("cart-b"));

        repository.deleteById("cart-b");

        assertTrue(repository.findById("cart-b").isEmpty());
    }

    @Test
    @DisplayName("null ID 조회와 삭제는 안전하게 무시된다")
    void testNullId() {
        assertTrue(repository.findById(null).isEmpty());
        assertDoesNotThrow(() -> repository.deleteById(null));
    }
}
