package com.rockdeals.pos.presentation.pos.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 항목 응답 DTO
 * stock_exceeded, can_add_more는 담을 때의 재고 기준 안내값
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItemResponse {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("available_stock")
    private Integer availableStock;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;

    @JsonProperty("stock_exceeded")
    private boolean stockExceeded;

    @JsonProperty("can_add_more")
    private boolean canAddMore;
}
