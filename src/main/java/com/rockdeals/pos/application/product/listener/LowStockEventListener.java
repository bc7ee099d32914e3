package com.rockdeals.pos.application.product.listener;

import com.rockdeals.pos.domain.product.event.LowStockEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * LowStockEventListener - 저재고 알림
 *
 * 이벤트 처리 시점: AFTER_COMMIT
 * - 판매가 커밋된 경우에만 알림 (롤백된 판매는 알림 없음)
 * - @Async로 결제 응답을 지연시키지 않음
 */
@Slf4j
@Component
public class LowStockEventListener {

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleLowStock(LowStockEvent event) {
        log.warn("[LowStockEventListener] 재고 보충 필요 - productId={}, name={}, stock={}, threshold={}",
                event.getProductId(), event.getProductName(), event.getRemainingStock(), event.getThreshold());
    }
}
