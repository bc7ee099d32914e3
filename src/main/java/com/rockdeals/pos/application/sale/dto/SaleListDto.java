package com.rockdeals.pos.application.sale.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 판매 목록 조회 결과 (페이지네이션)
 */
@Getter
@Builder
@AllArgsConstructor
public class SaleListDto {
    private final List<SaleSummaryDto> content;
    private final long totalElements;
    private final int totalPages;
    private final int currentPage;
    private final int size;
}
