package com.rockdeals.pos.presentation.pos.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 항목 수량 변경 요청 DTO (0 이하면 항목 제거)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateQuantityRequest {
    private Integer quantity;
}
