package com.rockdeals.pos.presentation.pos.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 할인율 변경 요청 DTO (0~100 범위로 보정)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscountRequest {
    @JsonProperty("discount_percent")
    private BigDecimal discountPercent;
}
