package com.rockdeals.pos.presentation.sale;

import com.rockdeals.pos.application.sale.SaleQueryService;
import com.rockdeals.pos.application.sale.SaleRefundService;
import com.rockdeals.pos.application.sale.dto.RefundResult;
import com.rockdeals.pos.application.sale.dto.SaleListDto;
import com.rockdeals.pos.application.sale.dto.SaleSummaryDto;
import com.rockdeals.pos.application.sale.dto.ReceiptDto;
import com.rockdeals.pos.application.sale.dto.ReceiptLineDto;
import com.rockdeals.pos.domain.cart.PaymentMethod;
import com.rockdeals.pos.domain.sale.SaleAlreadyRefundedException;
import com.rockdeals.pos.domain.sale.SaleNotFoundException;
import com.rockdeals.pos.domain.sale.SaleSearchCondition;
import com.rockdeals.pos.domain.sale.SaleStatus;
import com.rockdeals.pos.presentation.common.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SaleController 단위 테스트")
class SaleControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SaleQueryService saleQueryService;

    @Mock
    private SaleRefundService saleRefundService;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new SaleController(saleQueryService, saleRefundService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("영수증 조회 - 카드 결제는 받은 금액을 생략한다")
    void testGetReceipt_Card() throws Exception {
        // Given
        ReceiptDto receipt = ReceiptDto.builder()
                .saleId(5L)
                .receiptNumber("RCP-20261019-ABC123")
                .soldAt(LocalDateTime.of(2026, 10, 19, 9, 30))
                .lines(List.of(ReceiptLineDto.builder()
                        .productId(1L)
                        .productName("Wireless Mouse")
                        .quantity(2)
                        .unitPrice(new BigDecimal("29.99"))
                        .lineTotal(new BigDecimal("59.98"))
                        .build()))
                .subtotal(new BigDecimal("59.98"))
                .discountPercent(BigDecimal.ZERO)
                .discountAmount(new BigDecimal("0.00"))
                .taxPercent(BigDecimal.valueOf(15))
                .taxAmount(new BigDecimal("9.00"))
                .totalAmount(new BigDecimal("68.98"))
                .paymentMethod(PaymentMethod.CARD)
                .changeDue(new BigDecimal("0.00"))
                .status(SaleStatus.COMPLETED)
                .build();
        when(saleQueryService.getReceipt(5L)).thenReturn(receipt);

        // When & Then
        mockMvc.perform(get("/sales/{sale_id}/receipt", 5L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.receipt_number").value("RCP-20261019-ABC123"))
                .andExpect(jsonPath("$.total_amount").value(68.98))
                .andExpect(jsonPath("$.amount_tendered").doesNotExist());
    }

    @Test
    @DisplayName("없는 판매 - 404")
    void testGetReceipt_NotFound() throws Exception {
        when(saleQueryService.getReceipt(9L)).thenThrow(new SaleNotFoundException(9L));

        mockMvc.perform(get("/sales/{sale_id}/receipt", 9L))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_SALE_NOT_FOUND"));
    }

    // ========== 판매 목록 ==========

    @Test
    @DisplayName("판매 목록 - 조건 전달, 페이지 정보 응답")
    void testListSales_Success() throws Exception {
        // Given
        SaleSummaryDto refunded = SaleSummaryDto.builder()
                .saleId(5L)
                .receiptNumber("RCP-20261019-ABC123")
                .soldAt(LocalDateTime.of(2026, 10, 19, 9, 30))
                .totalAmount(new BigDecimal("68.98"))
                .paymentMethod(PaymentMethod.CARD)
                .status(SaleStatus.REFUNDED)
                .refundAmount(new BigDecimal("68.98"))
                .build();
        when(saleQueryService.listSales(any(SaleSearchCondition.class)))
                .thenReturn(new SaleListDto(List.of(refunded), 11L, 2, 1, 10));

        // When & Then
        mockMvc.perform(get("/sales")
                        .param("status", "REFUNDED")
                        .param("from", "2026-10-19T00:00:00")
                        .param("page", "1")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].sale_id").value(5))
                .andExpect(jsonPath("$.content[0].status").value("REFUNDED"))
                .andExpect(jsonPath("$.content[0].refund_amount").value(68.98))
                .andExpect(jsonPath("$.content[0].customer_id").doesNotExist())
                .andExpect(jsonPath("$.total_elements").value(11))
                .andExpect(jsonPath("$.total_pages").value(2))
                .andExpect(jsonPath("$.current_page").value(1));

        ArgumentCaptor<SaleSearchCondition> captor = ArgumentCaptor.forClass(SaleSearchCondition.class);
        verify(saleQueryService).listSales(captor.capture());
        assertEquals(SaleStatus.REFUNDED, captor.getValue().getStatus());
        assertEquals(LocalDateTime.of(2026, 10, 19, 0, 0), captor.getValue().getFrom());
        assertNull(captor.getValue().getTo());
        assertEquals(10, captor.getValue().getSize());
    }

    @Test
    @DisplayName("알 수 없는 판매 상태 - 400")
    void testListSales_UnknownStatus() throws Exception {
        mockMvc.perform(get("/sales").param("status", "VOIDED"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(saleQueryService);
    }

    // ========== 환불 ==========

    @Test
    @DisplayName("판매 환불 - 환불 금액과 복구된 재고 응답")
    void testRefundSale_Success() throws Exception {
        // Given
        RefundResult result = RefundResult.builder()
                .saleId(5L)
                .receiptNumber("RCP-20261019-ABC123")
                .refundAmount(new BigDecimal("68.98"))
                .refundedAt(LocalDateTime.of(2026, 10, 19, 11, 0))
                .restoredItems(List.of(new RefundResult.RestoredItem(1L, 2)))
                .build();
        when(saleRefundService.refundSale(5L, "불량")).thenReturn(result);

        // When & Then
        mockMvc.perform(post("/sales/{sale_id}/refund", 5L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"불량\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refund_amount").value(68.98))
                .andExpect(jsonPath("$.restored_items[0].product_id").value(1))
                .andExpect(jsonPath("$.restored_items[0].quantity").value(2));
    }

    @Test
    @DisplayName("본문 없는 환불 - 사유 null로 전달")
    void testRefundSale_NoBody() throws Exception {
        when(saleRefundService.refundSale(5L, null)).thenReturn(RefundResult.builder()
                .saleId(5L)
                .refundAmount(new BigDecimal("68.98"))
                .restoredItems(List.of())
                .build());

        mockMvc.perform(post("/sales/{sale_id}/refund", 5L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sale_id").value(5));
    }

    @Test
    @DisplayName("이미 환불된 판매 - 409")
    void testRefundSale_AlreadyRefunded() throws Exception {
        when(saleRefundService.refundSale(5L, null)).thenThrow(new SaleAlreadyRefundedException(5L));

        mockMvc.perform(post("/sales/{sale_id}/refund", 5L))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_SALE_ALREADY_REFUNDED"));
    }
}
