package com.rockdeals.pos.application.sale;

import com.rockdeals.pos.domain.sale.SaleReceipt;
import com.rockdeals.pos.domain.sale.SaleRequest;
import com.rockdeals.pos.domain.sale.SaleStorage;
import com.rockdeals.pos.domain.sale.ServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * SaleStorageService - SaleStorage 포트 구현
 *
 * 역할:
 * - SaleTransactionService(트랜잭션 프록시)를 호출
 * - 커밋 단계를 포함한 인프라 오류를 ServiceUnavailableException으로 변환
 *
 * 분리 이유:
 * - 커밋 실패는 @Transactional 메서드 밖(프록시)에서 발생하므로
 *   트랜잭션 바깥 계층에서만 잡을 수 있다
 *
 * 도메인 예외(재고 부족, 검증 실패)는 그대로 전달한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SaleStorageService implements SaleStorage {

    private final SaleTransactionService saleTransactionService;

    @Override
    public SaleReceipt createSale(SaleRequest request) {
        try {
            return saleTransactionService.createSale(request);
        } catch (DataAccessException | TransactionException e) {
            log.error("[SaleStorageService] 판매 저장소 오류 - cartId={}, total={}, error={}",
                    request.getCartId(), request.getTotalAmount(), e.getMessage(), e);
            throw new ServiceUnavailableException(e);
        }
    }
}
