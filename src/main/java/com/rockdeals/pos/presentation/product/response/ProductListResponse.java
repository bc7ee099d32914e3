package com.rockdeals.pos.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rockdeals.pos.application.product.dto.CatalogPage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {
    @JsonProperty("products")
    private List<ProductResponse> products;

    @JsonProperty("count")
    private Integer count;

    @JsonProperty("limit")
    private Integer limit;

    public static ProductListResponse from(CatalogPage page) {
        List<ProductResponse> products = page.getProducts().stream()
                .map(ProductResponse::from)
                .collect(Collectors.toList());
        return ProductListResponse.builder()
                .products(products)
                .count(products.size())
                .limit(page.getLimit())
                .build();
    }
}
