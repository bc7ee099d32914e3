package com.rockdeals.pos.unit.application.sale;

import com.rockdeals.pos.application.sale.ReceiptNumberGenerator;
import com.rockdeals.pos.application.sale.SaleTransactionService;
import com.rockdeals.pos.application.sale.dto.RefundResult;
import com.rockdeals.pos.config.TestDataFactory;
import com.rockdeals.pos.domain.cart.Cart;
import com.rockdeals.pos.domain.common.vo.Money;
import com.rockdeals.pos.domain.customer.CustomerRepository;
import com.rockdeals.pos.domain.product.OutOfStockException;
import com.rockdeals.pos.domain.product.Product;
import com.rockdeals.pos.domain.product.ProductRepository;
import com.rockdeals.pos.domain.product.event.LowStockEvent;
import com.rockdeals.pos.domain.sale.Sale;
import com.rockdeals.pos.domain.sale.SaleAlreadyRefundedException;
import com.rockdeals.pos.domain.sale.SaleNotFoundException;
import com.rockdeals.pos.domain.sale.SaleReceipt;
import com.rockdeals.pos.domain.sale.SaleRepository;
import com.rockdeals.pos.domain.sale.SaleRequest;
import com.rockdeals.pos.domain.sale.SaleStatus;
import com.rockdeals.pos.domain.sale.SaleValidationException;
import com.rockdeals.pos.domain.sale.event.SaleCompletedEvent;
import com.rockdeals.pos.domain.sale.event.SaleRefundedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SaleTransactionService 단위 테스트")
class SaleTransactionServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private CustomerRepository customerRepository;

    @Mock
    private SaleRepository saleRepository;

    @Mock
    private ReceiptNumberGenerator receiptNumberGenerator;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SaleTransactionService saleTransactionService;

    private Product mouse;
    private Product keyboard;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T10:15:30Z"), ZoneOffset.UTC);
        saleTransactionService = new SaleTransactionService(
                productRepository, customerRepository, saleRepository,
                receiptNumberGenerator, eventPublisher, clock);

        mouse = TestDataFactory.product(1L, "Wireless Mouse", "29.99", 10);
        keyboard = TestDataFactory.product(2L, "Keyboard", "49.50", 5);
    }

    private SaleRequest requestFor(Long customerId, Product... products) {
        Cart cart = TestDataFactory.emptyCart("cart-tx");
        for (Product product : products) {
            cart.addItem(product);
        }
        cart.setCustomer(customerId);
        cart.setAmountTendered(new BigDecimal("500.00"));
        return SaleRequest.from(cart);
    }

    // ========== 성공 ==========

    @Test
    @DisplayName("판매 확정 - 상품 ID 오름차순으로 차감하고 판매 저장 후 이벤트 발행")
    void testCreateSale_Success() {
        // Given
        SaleRequest request = requestFor(null, keyboard, mouse, mouse);
        when(productRepository.decreaseStock(anyLong(), anyInt())).thenReturn(1);
        when(receiptNumberGenerator.next()).thenReturn("RCP-20261019-ABCDEF");
        when(saleRepository.save(any(Sale.class))).thenAnswer(invocation -> {
            Sale sale = invocation.getArgument(0);
            ReflectionTestUtils.setField(sale, "saleId", 42L);
            return sale;
        });
        Product keyboardAfterSale = TestDataFactory.product(2L, "Keyboard", "49.50", 1);
        when(productRepository.findAllById(anyList())).thenReturn(List.of(mouse, keyboardAfterSale));

        // When
        SaleReceipt receipt = saleTransactionService.createSale(request);

        // Then
        assertEquals(42L, receipt.getSaleId());
        assertEquals("RCP-20261019-ABCDEF", receipt.getReceiptNumber());

        InOrder inOrder = inOrder(productRepository);
        inOrder.verify(productRepository).decreaseStock(1L, 2);
        inOrder.verify(productRepository).decreaseStock(2L, 1);

        ArgumentCaptor<Sale> saleCaptor = ArgumentCaptor.forClass(Sale.class);
        verify(saleRepository, times(1)).save(saleCaptor.capture());
        Sale saved = saleCaptor.getValue();
        assertEquals("RCP-20261019-ABCDEF", saved.getReceiptNumber());
        assertEquals(2, saved.getItems().size());
        assertEquals(request.getTotalAmount(), saved.totalAsMoney());

        ArgumentCaptor<Object> eventCaptor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(eventCaptor.capture());
        List<Object> events = eventCaptor.getAllValues();
        LowStockEvent lowStock = (LowStockEvent) events.get(0);
        assertEquals(2L, lowStock.getProductId());
        assertEquals(1, lowStock.getRemainingStock());
        SaleCompletedEvent completed = (SaleCompletedEvent) events.get(1);
        assertEquals(42L, completed.getSaleId());
        assertEquals(List.of(1L, 2L), completed.getProductIds());
    }

    @Test
    @DisplayName("고객이 지정되면 고객 존재 여부를 확인한다")
    void testCreateSale_WithCustomer() {
        // Given
        SaleRequest request = requestFor(7L, mouse);
        when(customerRepository.existsById(7L)).thenReturn(true);
        when(productRepository.decreaseStock(1L, 1)).thenReturn(1);
        when(receiptNumberGenerator.next()).thenReturn("RCP-20261019-000001");
        when(saleRepository.save(any(Sale.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(productRepository.findAllById(anyList())).thenReturn(List.of(mouse));

        // When
        saleTransactionService.createSale(request);

        // Then
        ArgumentCaptor<Sale> saleCaptor = ArgumentCaptor.forClass(Sale.class);
        verify(saleRepository).save(saleCaptor.capture());
        assertEquals(7L, saleCaptor.getValue().getCustomerId());
    }

    // ========== 실패 ==========

    @Test
    @DisplayName("재고 부족 - OutOfStockException(현재 재고), 판매 저장 없음")
    void testCreateSale_OutOfStock() {
        // Given
        SaleRequest request = requestFor(null, mouse, keyboard);
        Product lowMouse = TestDataFactory.product(1L, "Wireless Mouse", "29.99", 0);
        when(productRepository.decreaseStock(1L, 1)).thenReturn(0);
        when(productRepository.findById(1L)).thenReturn(Optional.of(lowMouse));

        // When
        OutOfStockException exception = assertThrows(OutOfStockException.class,
                () -> saleTransactionService.createSale(request));

        // Then
        assertEquals(1L, exception.getProductId());
        assertEquals(0, exception.getAvailable());
        verify(productRepository, never()).decreaseStock(2L, 1);
        verify(saleRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("판매 중지 상품 - SaleValidationException(product_id)")
    void testCreateSale_InactiveProduct() {
        // Given
        SaleRequest request = requestFor(null, mouse);
        Product inactive = TestDataFactory.product(1L, "Wireless Mouse", "29.99", 10);
        inactive.deactivate(LocalDateTime.of(2026, 10, 19, 9, 0));
        when(productRepository.decreaseStock(1L, 1)).thenReturn(0);
        when(productRepository.findById(1L)).thenReturn(Optional.of(inactive));

        // When
        SaleValidationException exception = assertThrows(SaleValidationException.class,
                () -> saleTransactionService.createSale(request));

        // Then
        assertEquals("product_id", exception.getField());
        verify(saleRepository, never()).save(any());
    }

    @Test
    @DisplayName("존재하지 않는 상품 - SaleValidationException(product_id)")
    void testCreateSale_MissingProduct() {
        SaleRequest request = requestFor(null, mouse);
        when(productRepository.decreaseStock(1L, 1)).thenReturn(0);
        when(productRepository.findById(1L)).thenReturn(Optional.empty());

        SaleValidationException exception = assertThrows(SaleValidationException.class,
                () -> saleTransactionService.createSale(request));

        assertEquals("product_id", exception.getField());
    }

    @Test
    @DisplayName("존재하지 않는 고객 - 재고 차감 전에 SaleValidationException(customer_id)")
    void testCreateSale_MissingCustomer() {
        // Given
        SaleRequest request = requestFor(99L, mouse);
        when(customerRepository.existsById(99L)).thenReturn(false);

        // When
        SaleValidationException exception = assertThrows(SaleValidationException.class,
                () -> saleTransactionService.createSale(request));

        // Then
        assertEquals("customer_id", exception.getField());
        verify(productRepository, never()).decreaseStock(anyLong(), anyInt());
    }

    @Test
    @DisplayName("항목이 없는 요청 - SaleValidationException(items)")
    void testCreateSale_NoLines() {
        SaleRequest request = SaleRequest.from(TestDataFactory.emptyCart("cart-none"));

        SaleValidationException exception = assertThrows(SaleValidationException.class,
                () -> saleTransactionService.createSale(request));

        assertEquals("items", exception.getField());
        verifyNoInteractions(productRepository, saleRepository, eventPublisher);
    }

    // ========== 환불 ==========

    private Sale completedSale(Long saleId) {
        Sale sale = Sale.create(requestFor(null, keyboard, mouse, mouse), "RCP-20261019-ABCDEF",
                LocalDateTime.of(2026, 10, 19, 9, 0));
        ReflectionTestUtils.setField(sale, "saleId", saleId);
        return sale;
    }

    @Test
    @DisplayName("판매 환불 - 상품 ID 오름차순으로 재고 복구, 환불 금액은 판매 합계")
    void testRefundSale_Success() {
        // Given
        Sale sale = completedSale(42L);
        when(saleRepository.findByIdForUpdate(42L)).thenReturn(Optional.of(sale));
        when(productRepository.increaseStock(anyLong(), anyInt())).thenReturn(1);

        // When
        RefundResult result = saleTransactionService.refundSale(42L, "damaged box");

        // Then
        InOrder inOrder = inOrder(productRepository);
        inOrder.verify(productRepository).increaseStock(1L, 2);
        inOrder.verify(productRepository).increaseStock(2L, 1);

        assertEquals(Money.ofCents(sale.getTotalAmount()).toBigDecimal(), result.getRefundAmount());
        assertEquals(LocalDateTime.of(2026, 10, 19, 10, 15, 30), result.getRefundedAt());
        assertEquals(2, result.getRestoredItems().size());
        assertEquals(SaleStatus.REFUNDED, sale.getStatus());
        assertEquals("damaged box", sale.getRefundReason());
        verify(saleRepository).save(sale);

        ArgumentCaptor<SaleRefundedEvent> eventCaptor = ArgumentCaptor.forClass(SaleRefundedEvent.class);
        verify(eventPublisher).publishEvent(eventCaptor.capture());
        assertEquals(List.of(1L, 2L), eventCaptor.getValue().getProductIds());
        assertEquals(sale.getTotalAmount(), eventCaptor.getValue().getRefundAmountCents());
    }

    @Test
    @DisplayName("이미 환불된 판매 - SaleAlreadyRefundedException, 재고 복구 없음")
    void testRefundSale_AlreadyRefunded() {
        Sale sale = completedSale(43L);
        sale.refund(null, LocalDateTime.of(2026, 10, 19, 9, 30));
        when(saleRepository.findByIdForUpdate(43L)).thenReturn(Optional.of(sale));

        assertThrows(SaleAlreadyRefundedException.class, () -> saleTransactionService.refundSale(43L, null));

        verify(productRepository, never()).increaseStock(anyLong(), anyInt());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("없는 판매 환불 - SaleNotFoundException")
    void testRefundSale_NotFound() {
        when(saleRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThrows(SaleNotFoundException.class, () -> saleTransactionService.refundSale(99L, null));
        verify(productRepository, never()).increaseStock(anyLong(), anyInt());
    }

    @Test
    @DisplayName("상품 행이 사라진 판매 환불 - SaleValidationException(product_id), 이벤트 없음")
    void testRefundSale_ProductMissing() {
        Sale sale = completedSale(44L);
        when(saleRepository.findByIdForUpdate(44L)).thenReturn(Optional.of(sale));
        when(productRepository.increaseStock(1L, 2)).thenReturn(0);

        SaleValidationException exception = assertThrows(SaleValidationException.class,
                () -> saleTransactionService.refundSale(44L, null));

        assertEquals("product_id", exception.getField());
        verify(saleRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }
}
