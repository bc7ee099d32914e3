package com.rockdeals.pos.unit.application.sale;

import com.rockdeals.pos.application.sale.SaleRefundService;
import com.rockdeals.pos.application.sale.SaleTransactionService;
import com.rockdeals.pos.application.sale.dto.RefundResult;
import com.rockdeals.pos.domain.sale.SaleAlreadyRefundedException;
import com.rockdeals.pos.domain.sale.ServiceUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SaleRefundService 단위 테스트")
class SaleRefundServiceTest {

    @Mock
    private SaleTransactionService saleTransactionService;

    @InjectMocks
    private SaleRefundService saleRefundService;

    @Test
    @DisplayName("환불 사유는 공백을 제거하고 빈 값은 null로 전달한다")
    void testRefundSale_NormalizesReason() {
        RefundResult result = new RefundResult(5L, "RCP-20261019-ABCDEF", new BigDecimal("68.98"),
                LocalDateTime.of(2026, 10, 19, 11, 0), List.of(new RefundResult.RestoredItem(1L, 2)));
        when(saleTransactionService.refundSale(5L, "wrong size")).thenReturn(result);
        when(saleTransactionService.refundSale(6L, null)).thenReturn(result);

        assertSame(result, saleRefundService.refundSale(5L, "  wrong size "));
        assertSame(result, saleRefundService.refundSale(6L, "   "));
    }

    @Test
    @DisplayName("저장소 오류는 ServiceUnavailableException으로 변환한다")
    void testRefundSale_DataAccessFailure() {
        when(saleTransactionService.refundSale(7L, null)).thenThrow(new QueryTimeoutException("timeout"));

        ServiceUnavailableException exception = assertThrows(ServiceUnavailableException.class,
                () -> saleRefundService.refundSale(7L, null));
        assertInstanceOf(QueryTimeoutException.class, exception.getCause());
    }

    @Test
    @DisplayName("도메인 예외는 그대로 전달한다")
    void testRefundSale_DomainExceptionPropagates() {
        when(saleTransactionService.refundSale(8L, null)).thenThrow(new SaleAlreadyRefundedException(8L));

        assertThrows(SaleAlreadyRefundedException.class, () -> saleRefundService.refundSale(8L, null));
    }
}
