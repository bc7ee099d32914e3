package com.rockdeals.pos.presentation.pos.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 고객 지정 요청 DTO (null이면 해제)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerRequest {
    @JsonProperty("customer_id")
    private Long customerId;
}
