package com.rockdeals.pos.application.sale;

import com.rockdeals.pos.application.sale.dto.RefundResult;
import com.rockdeals.pos.domain.sale.ServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * SaleRefundService - 판매 환불
 *
 * SaleTransactionService.refundSale(트랜잭션 프록시)을 호출하고
 * 커밋 단계를 포함한 인프라 오류를 ServiceUnavailableException으로 변환한다.
 * 도메인 예외(판매 없음, 이미 환불됨)는 그대로 전달한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SaleRefundService {

    private final SaleTransactionService saleTransactionService;

    public RefundResult refundSale(Long saleId, String reason) {
        try {
            return saleTransactionService.refundSale(saleId, normalizeReason(reason));
        } catch (DataAccessException | TransactionException e) {
            log.error("[SaleRefundService] 환불 저장소 오류 - saleId={}, error={}", saleId, e.getMessage(), e);
            throw new ServiceUnavailableException(e);
        }
    }

    private static String normalizeReason(String reason) {
        return reason == null || reason.isBlank() ? null : reason.trim();
    }
}
