package com.rockdeals.pos.application.sale;

import com.rockdeals.pos.domain.sale.SaleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * 영수증 번호 생성기
 *
 * 형식: RCP-yyyyMMdd-XXXXXX (X: 대문자 16진수 6자리)
 * 예: RCP-20261019-3FA9C2
 *
 * 같은 번호가 이미 있으면 최대 MAX_ATTEMPTS 번 다시 뽑는다.
 * 최종 유일성은 sales.receipt_number 유니크 제약이 보장한다.
 */
@Component
@RequiredArgsConstructor
public class ReceiptNumberGenerator {

    static final String PREFIX = "RCP-";
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final int SUFFIX_LENGTH = 6;
    private static final int MAX_ATTEMPTS = 5;

    private final SaleRepository saleRepository;
    private final Clock clock;

    public String next() {
        String datePart = LocalDate.now(clock).format(DATE_FORMAT);
        String candidate = build(datePart);
        for (int attempt = 1; attempt < MAX_ATTEMPTS && saleRepository.existsByReceiptNumber(candidate); attempt++) {
            candidate = build(datePart);
        }
        return candidate;
    }

    private String build(String datePart) {
        String suffix = UUID.randomUUID().toString()
                .replace("-", "")
                .substring(0, SUFFIX_LENGTH)
                .toUpperCase();
        return PREFIX + datePart + "-" + suffix;
    }
}
