package com.rockdeals.pos.presentation.sale.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 판매 환불 요청 DTO (본문 생략 가능)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefundRequest {
    @JsonProperty("reason")
    private String reason;
}
