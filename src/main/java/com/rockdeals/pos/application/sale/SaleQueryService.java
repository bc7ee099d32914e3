package com.rockdeals.pos.application.sale;

import com.rockdeals.pos.application.sale.dto.ReceiptDto;
import com.rockdeals.pos.application.sale.dto.ReceiptLineDto;
import com.rockdeals.pos.application.sale.dto.SaleListDto;
import com.rockdeals.pos.application.sale.dto.SaleSummaryDto;
import com.rockdeals.pos.domain.common.vo.Money;
import com.rockdeals.pos.domain.customer.Customer;
import com.rockdeals.pos.domain.customer.CustomerRepository;
import com.rockdeals.pos.domain.sale.Sale;
import com.rockdeals.pos.domain.sale.SaleNotFoundException;
import com.rockdeals.pos.domain.sale.SaleRepository;
import com.rockdeals.pos.domain.sale.SaleSearchCondition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SaleQueryService - 영수증/판매 목록 조회
 */
@Service
@RequiredArgsConstructor
public class SaleQueryService {

    private final SaleRepository saleRepository;
    private final CustomerRepository customerRepository;

    /**
     * 판매 영수증 조회
     *
     * @throws SaleNotFoundException 판매가 없는 경우
     */
    @Transactional(readOnly = true)
    public ReceiptDto getReceipt(Long saleId) {
        Sale sale = saleRepository.findById(saleId)
                .orElseThrow(() -> new SaleNotFoundException(saleId));

        String customerName = sale.getCustomerId() == null ? null
                : customerRepository.findById(sale.getCustomerId())
                        .map(Customer::getName)
                        .orElse(null);

        List<ReceiptLineDto> lines = sale.getItems().stream()
                .map(item -> ReceiptLineDto.builder()
                        .productId(item.getProductId())
                        .productName(item.getProductName())
                        .quantity(item.getQuantity())
                        .unitPrice(item.unitPriceAsMoney().toBigDecimal())
                        .lineTotal(item.lineTotalAsMoney().toBigDecimal())
                        .build())
                .collect(Collectors.toList());

        return ReceiptDto.builder()
                .saleId(sale.getSaleId())
                .receiptNumber(sale.getReceiptNumber())
                .soldAt(sale.getCreatedAt())
                .customerId(sale.getCustomerId())
                .customerName(customerName)
                .lines(lines)
                .subtotal(amount(sale.getSubtotal()))
                .discountPercent(sale.getDiscountPercent())
                .discountAmount(amount(sale.getDiscountAmount()))
                .taxPercent(sale.getTaxPercent())
                .taxAmount(amount(sale.getTaxAmount()))
                .totalAmount(amount(sale.getTotalAmount()))
                .paymentMethod(sale.getPaymentMethod())
                .amountTendered(sale.getAmountTendered() == null ? null : amount(sale.getAmountTendered()))
                .changeDue(amount(sale.getChangeDue()))
                .status(sale.getStatus())
                .refundAmount(sale.getRefundAmount() == null ? null : amount(sale.getRefundAmount()))
                .refundedAt(sale.getRefundedAt())
                .build();
    }

    /**
     * 판매 목록 조회 (최신순, 페이지네이션)
     */
    @Transactional(readOnly = true)
    public SaleListDto listSales(SaleSearchCondition condition) {
        List<SaleSummaryDto> content = saleRepository.search(condition).stream()
                .map(SaleSummaryDto::from)
                .collect(Collectors.toList());
        long totalElements = saleRepository.count(condition);

        return SaleListDto.builder()
                .content(content)
                .totalElements(totalElements)
                .totalPages(condition.totalPages(totalElements))
                .currentPage(condition.getPage())
                .size(condition.getSize())
                .build();
    }

    private static BigDecimal amount(Long cents) {
        return Money.ofCents(cents).toBigDecimal();
    }
}
