package com.rockdeals.pos.unit.domain.product;

import com.rockdeals.pos.domain.product.ProductSearchCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProductSearchCondition 테스트")
class ProductSearchConditionTest {

    @Test
    @DisplayName("조건 미지정 시 limit 100, 검색어/카테고리 없음")
    void testDefaults() {
        ProductSearchCondition condition = ProductSearchCondition.all();

        assertNull(condition.getSearch());
        assertNull(condition.getCategoryName());
        assertEquals(100, condition.getLimit());
    }

    @Test
    @DisplayName("limit은 1~500으로 보정된다")
    void testLimitClamped() {
        assertEquals(1, ProductSearchCondition.of(null, null, 0).getLimit());
        assertEquals(500, ProductSearchCondition.of(null, null, 10_000).getLimit());
        assertEquals(20, ProductSearchCondition.of(null, null, 20).getLimit());
    }

    @Test
    @DisplayName("공백 검색어는 무시하고 캐시 키는 대소문자를 구분하지 않는다")
    void testNormalization() {
        ProductSearchCondition blank = ProductSearchCondition.of("   ", "", null);
        assertNull(blank.getSearch());
        assertNull(blank.getCategoryName());

        assertEquals(
                ProductSearchCondition.of(" Mouse ", "Peripherals", 50).cacheKey(),
                ProductSearchCondition.of("mouse", "Peripherals", 50).cacheKey());
    }
}
