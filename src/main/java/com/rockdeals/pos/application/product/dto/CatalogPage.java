package com.rockdeals.pos.application.product.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 카탈로그 검색 결과 묶음
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CatalogPage {
    private List<CatalogProduct> products = new ArrayList<>();
    private int limit;

    public int getCount() {
        return products.size();
    }
}
