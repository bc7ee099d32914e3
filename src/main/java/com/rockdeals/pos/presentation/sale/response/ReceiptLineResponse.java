package com.rockdeals.pos.presentation.sale.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.application.sale.dto.ReceiptLineDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptLineResponse {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;

    public static ReceiptLineResponse from(ReceiptLineDto line) {
        return ReceiptLineResponse.builder()
                .productId(line.getProductId())
                .productName(line.getProductName())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .lineTotal(line.getLineTotal())
                .build();
    }
}
