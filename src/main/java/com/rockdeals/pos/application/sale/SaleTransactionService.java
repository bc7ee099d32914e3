package com.rockdeals.pos.application.sale;

import com.rockdeals.pos.domain.customer.CustomerRepository;
import com.rockdeals.pos.domain.product.OutOfStockException;
import com.rockdeals.pos.domain.product.Product;
import com.rockdeals.pos.domain.product.ProductRepository;
import com.rockdeals.pos.domain.product.event.LowStockEvent;
import com.rockdeals.pos.application.sale.dto.RefundResult;
import com.rockdeals.pos.domain.common.vo.Money;
import com.rockdeals.pos.domain.sale.Sale;
import com.rockdeals.pos.domain.sale.SaleAlreadyRefundedException;
import com.rockdeals.pos.domain.sale.SaleItem;
import com.rockdeals.pos.domain.sale.SaleLine;
import com.rockdeals.pos.domain.sale.SaleNotFoundException;
import com.rockdeals.pos.domain.sale.SaleReceipt;
import com.rockdeals.pos.domain.sale.SaleRepository;
import com.rockdeals.pos.domain.sale.SaleRequest;
import com.rockdeals.pos.domain.sale.SaleValidationException;
import com.rockdeals.pos.domain.sale.event.SaleCompletedEvent;
import com.rockdeals.pos.domain.sale.event.SaleRefundedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * SaleTransactionService - 판매 확정/환불 트랜잭션
 *
 * 책임:
 * - 판매 요청 검증 (항목, 수량, 고객 참조)
 * - 상품별 재고 원자적 차감 (조건부 UPDATE)
 * - 판매/판매 항목 저장과 영수증 번호 발급
 * - 판매 환불과 재고 원자적 복구
 * - 커밋 이후 처리할 이벤트 발행 (판매 확정, 저재고, 환불)
 *
 * 트랜잭션:
 * - 하나의 트랜잭션에서 모든 항목을 차감하고 판매를 저장
 * - 어느 한 항목이라도 실패하면 전체 롤백 (부분 차감 없음)
 * - 상품 ID 오름차순으로 차감해 세션 간 교착 가능성을 줄임
 *
 * 재시도:
 * - 행 락 획득 실패(PessimisticLockingFailureException)만 재시도
 * - 재고 부족, 검증 실패는 재시도하지 않고 즉시 전달
 */
@Service
public class SaleTransactionService {

    private static final Logger log = LoggerFactory.getLogger(SaleTransactionService.class);

    static final int TRANSACTION_TIMEOUT_SECONDS = 5;

    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;
    private final SaleRepository saleRepository;
    private final ReceiptNumberGenerator receiptNumberGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public SaleTransactionService(ProductRepository productRepository,
                                  CustomerRepository customerRepository,
                                  SaleRepository saleRepository,
                                  ReceiptNumberGenerator receiptNumberGenerator,
                                  ApplicationEventPublisher eventPublisher,
                                  Clock clock) {
        this.productRepository = productRepository;
        this.customerRepository = customerRepository;
        this.saleRepository = saleRepository;
        this.receiptNumberGenerator = receiptNumberGenerator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 판매 확정
     *
     * 처리 순서:
     * 1. 요청 검증 (항목 존재, 수량 양수, 고객 존재)
     * 2. 상품 ID 오름차순으로 재고 차감, 0행 갱신 시 원인 분류
     * 3. 영수증 번호 발급 후 Sale 저장
     * 4. SaleCompletedEvent, LowStockEvent 발행
     *
     * @param request 장바구니 스냅샷
     * @return 판매 ID와 영수증 번호
     * @throws OutOfStockException 재고 부족
     * @throws SaleValidationException 존재하지 않거나 비활성인 상품, 존재하지 않는 고객
     */
    @Transactional(
        propagation = Propagation.REQUIRED,
        rollbackFor = Exception.class,
        timeout = TRANSACTION_TIMEOUT_SECONDS
    )
    @Retryable(
        retryFor = PessimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(
            delay = 50,
            multiplier = 2,
            maxDelay = 1000,
            random = true
        )
    )
    public SaleReceipt createSale(SaleRequest request) {
        validateRequest(request);

        List<SaleLine> orderedLines = request.getLines().stream()
                .sorted(Comparator.comparing(SaleLine::getProductId))
                .collect(Collectors.toList());

        for (SaleLine line : orderedLines) {
            deductStock(line);
        }

        String receiptNumber = receiptNumberGenerator.next();
        Sale sale = saleRepository.save(Sale.create(request, receiptNumber, LocalDateTime.now(clock)));

        log.info("[SaleTransactionService] 판매 저장 완료 - saleId={}, receiptNumber={}, total={}, lines={}",
                sale.getSaleId(), receiptNumber, request.getTotalAmount(), orderedLines.size());

        List<Long> productIds = orderedLines.stream()
                .map(SaleLine::getProductId)
                .collect(Collectors.toList());
        publishLowStockEvents(productIds);
        eventPublisher.publishEvent(new SaleCompletedEvent(
                sale.getSaleId(), receiptNumber, productIds, request.getTotalAmount().getCents()));

        return new SaleReceipt(sale.getSaleId(), receiptNumber);
    }

    /**
     * 판매 환불
     *
     * 처리 순서:
     * 1. 판매 행을 쓰기 락으로 조회 (동시 환불 직렬화)
     * 2. Sale.refund()로 상태 전환, 이미 환불된 판매는 거절
     * 3. 상품 ID 오름차순으로 판매 수량만큼 재고 복구
     * 4. SaleRefundedEvent 발행
     *
     * @param saleId 판매 ID
     * @param reason 환불 사유 (선택)
     * @throws SaleNotFoundException 판매가 없는 경우
     * @throws SaleAlreadyRefundedException 이미 환불된 판매
     * @throws SaleValidationException 판매 항목의 상품이 삭제된 경우
     */
    @Transactional(
        propagation = Propagation.REQUIRED,
        rollbackFor = Exception.class,
        timeout = TRANSACTION_TIMEOUT_SECONDS
    )
    @Retryable(
        retryFor = PessimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(
            delay = 50,
            multiplier = 2,
            maxDelay = 1000,
            random = true
        )
    )
    public RefundResult refundSale(Long saleId, String reason) {
        Sale sale = saleRepository.findByIdForUpdate(saleId)
                .orElseThrow(() -> new SaleNotFoundException(saleId));
        sale.refund(reason, LocalDateTime.now(clock));

        Map<Long, Integer> quantities = new TreeMap<>();
        for (SaleItem item : sale.getItems()) {
            quantities.merge(item.getProductId(), item.getQuantity(), Integer::sum);
        }

        List<RefundResult.RestoredItem> restoredItems = new ArrayList<>();
        for (Map.Entry<Long, Integer> entry : quantities.entrySet()) {
            int updated = productRepository.increaseStock(entry.getKey(), entry.getValue());
            if (updated == 0) {
                throw new SaleValidationException("product_id", "존재하지 않는 상품입니다: " + entry.getKey());
            }
            restoredItems.add(new RefundResult.RestoredItem(entry.getKey(), entry.getValue()));
        }

        saleRepository.save(sale);

        log.info("[SaleTransactionService] 판매 환불 완료 - saleId={}, receiptNumber={}, refundAmount={}, products={}",
                sale.getSaleId(), sale.getReceiptNumber(), sale.getRefundAmount(), quantities.keySet());

        eventPublisher.publishEvent(new SaleRefundedEvent(
                sale.getSaleId(), sale.getReceiptNumber(), new ArrayList<>(quantities.keySet()), sale.getRefundAmount()));

        return RefundResult.builder()
                .saleId(sale.getSaleId())
                .receiptNumber(sale.getReceiptNumber())
                .refundAmount(Money.ofCents(sale.getRefundAmount()).toBigDecimal())
                .refundedAt(sale.getRefundedAt())
                .restoredItems(restoredItems)
                .build();
    }

    private void validateRequest(SaleRequest request) {
        if (request.getLines().isEmpty()) {
            throw new SaleValidationException("items", "판매 항목이 비어 있습니다");
        }
        for (SaleLine line : request.getLines()) {
            if (line.getQuantity() <= 0) {
                throw new SaleValidationException("quantity",
                        "수량은 1 이상이어야 합니다: productId=" + line.getProductId());
            }
        }
        Long customerId = request.getCustomerId();
        if (customerId != null && !customerRepository.existsById(customerId)) {
            throw new SaleValidationException("customer_id", "존재하지 않는 고객입니다: " + customerId);
        }
    }

    /**
     * 재고 차감. 갱신된 행이 없으면 상품을 다시 읽어 원인을 구분한다.
     */
    private void deductStock(SaleLine line) {
        int updated = productRepository.decreaseStock(line.getProductId(), line.getQuantity());
        if (updated > 0) {
            return;
        }

        Optional<Product> product = productRepository.findById(line.getProductId());
        if (product.isEmpty()) {
            throw new SaleValidationException("product_id", "존재하지 않는 상품입니다: " + line.getProductId());
        }
        if (!product.get().isActive()) {
            throw new SaleValidationException("product_id", "판매 중지된 상품입니다: " + line.getProductId());
        }

        int available = product.get().getStockQuantity();
        log.warn("[SaleTransactionService] 재고 부족 - productId={}, requested={}, available={}",
                line.getProductId(), line.getQuantity(), available);
        throw new OutOfStockException(line.getProductId(), line.getQuantity(), available);
    }

    private void publishLowStockEvents(List<Long> productIds) {
        for (Product product : productRepository.findAllById(productIds)) {
            if (product.isLowStock()) {
                log.warn("[SaleTransactionService] 저재고 감지 - productId={}, stock={}, threshold={}",
                        product.getProductId(), product.getStockQuantity(), product.getLowStockThreshold());
                eventPublisher.publishEvent(new LowStockEvent(
                        product.getProductId(),
                        product.getName(),
                        product.getStockQuantity(),
                        product.getLowStockThreshold()
                ));
            }
        }
    }
}
