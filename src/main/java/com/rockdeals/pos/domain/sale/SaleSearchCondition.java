package com.rockdeals.pos.domain.sale;

import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 판매 목록 조회 조건
 *
 * - status: 판매 상태 (미지정 시 전체)
 * - from / to: 판매 시각 범위 (양 끝 포함, 미지정 시 제한 없음)
 * - page: 0부터 시작, 음수는 0으로 보정
 * - size: 1~100 범위로 보정, 미지정 시 20
 */
@Getter
public class SaleSearchCondition {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    private final SaleStatus status;
    private final LocalDateTime from;
    private final LocalDateTime to;
    private final int page;
    private final int size;

    private SaleSearchCondition(SaleStatus status, LocalDateTime from, LocalDateTime to, int page, int size) {
        this.status = status;
        this.from = from;
        this.to = to;
        this.page = page;
        this.size = size;
    }

    /**
     * @throws IllegalArgumentException from이 to보다 늦은 경우
     */
    public static SaleSearchCondition of(SaleStatus status, LocalDateTime from, LocalDateTime to,
                                         Integer page, Integer size) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("조회 시작 시각이 종료 시각보다 늦습니다: " + from + " > " + to);
        }
        int normalizedPage = page == null ? 0 : Math.max(0, page);
        int normalizedSize = size == null ? DEFAULT_PAGE_SIZE : Math.max(1, Math.min(MAX_PAGE_SIZE, size));
        return new SaleSearchCondition(status, from, to, normalizedPage, normalizedSize);
    }

    public int totalPages(long totalElements) {
        return (int) ((totalElements + size - 1) / size);
    }
}
