package com.rockdeals.pos.domain.product.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 상품 등록/수정/삭제 이벤트
 * 커밋 이후 카탈로그 캐시 무효화에 사용된다.
 */
@Getter
@AllArgsConstructor
public class ProductChangedEvent {

    public enum ChangeType {
        CREATED,
        UPDATED,
        DELETED
    }

    private final Long productId;
    private final ChangeType changeType;
}
