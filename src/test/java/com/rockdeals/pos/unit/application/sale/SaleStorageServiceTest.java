package com.rockdeals.pos.unit.application.sale;

import com.rockdeals.pos.application.sale.SaleStorageService;
import com.rockdeals.pos.application.sale.SaleTransactionService;
import com.rockdeals.pos.config.TestDataFactory;
import com.rockdeals.pos.domain.product.OutOfStockException;
import com.rockdeals.pos.domain.sale.SaleReceipt;
import com.rockdeals.pos.domain.sale.SaleRequest;
import com.rockdeals.pos.domain.sale.ServiceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.CannotCreateTransactionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SaleStorageService 단위 테스트")
class SaleStorageServiceTest {

    @Mock
    private SaleTransactionService saleTransactionService;

    @InjectMocks
    private SaleStorageService saleStorageService;

    private SaleRequest request;

    @BeforeEach
    void setUp() {
        request = SaleRequest.from(TestDataFactory.cartTotaling6898("cart-storage"));
    }

    @Test
    @DisplayName("정상 저장 결과를 그대로 반환")
    void testCreateSale_Success() {
        when(saleTransactionService.createSale(request)).thenReturn(new SaleReceipt(1L, "RCP-20261019-AAAAAA"));

        SaleReceipt receipt = saleStorageService.createSale(request);

        assertEquals(1L, receipt.getSaleId());
    }

    @Test
    @DisplayName("데이터 접근 오류는 ServiceUnavailableException으로 변환")
    void testCreateSale_DataAccessError() {
        CannotAcquireLockException cause = new CannotAcquireLockException("lock wait timeout");
        when(saleTransactionService.createSale(request)).thenThrow(cause);

        ServiceUnavailableException exception = assertThrows(ServiceUnavailableException.class,
                () -> saleStorageService.createSale(request));

        assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("트랜잭션 오류는 ServiceUnavailableException으로 변환")
    void testCreateSale_TransactionError() {
        when(saleTransactionService.createSale(request))
                .thenThrow(new CannotCreateTransactionException("connection refused"));

        assertThrows(ServiceUnavailableException.class, () -> saleStorageService.createSale(request));
    }

    @Test
    @DisplayName("재고 부족 같은 도메인 예외는 변환하지 않는다")
    void testCreateSale_DomainErrorPassesThrough() {
        when(saleTransactionService.createSale(request)).thenThrow(new OutOfStockException(1L, 2, 0));

        assertThrows(OutOfStockException.class, () -> saleStorageService.createSale(request));
    }
}
