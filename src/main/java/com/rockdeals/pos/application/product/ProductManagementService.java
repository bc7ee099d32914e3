package com.rockdeals.pos.application.product;

import com.rockdeals.pos.application.product.dto.CatalogProduct;
import com.rockdeals.pos.application.product.dto.ProductCommand;
import com.rockdeals.pos.domain.common.vo.Money;
import com.rockdeals.pos.domain.product.DuplicateBarcodeException;
import com.rockdeals.pos.domain.product.Product;
import com.rockdeals.pos.domain.product.ProductNotFoundException;
import com.rockdeals.pos.domain.product.ProductRepository;
import com.rockdeals.pos.domain.product.event.ProductChangedEvent;
import com.rockdeals.pos.domain.product.event.ProductChangedEvent.ChangeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * ProductManagementService - 상품 등록/수정/삭제
 *
 * 비즈니스 규칙:
 * - 바코드는 상품 간 중복 불가 (DuplicateBarcodeException)
 * - 재고 수량 변경은 단일 UPDATE 문으로 수행 (동시 판매 차감과 충돌하지 않음)
 * - 삭제는 비활성화 (과거 판매 항목이 상품 ID를 참조)
 * - 변경이 커밋되면 ProductCatalogCacheListener가 카탈로그 캐시를 비운다
 */
@Slf4j
@Service
public class ProductManagementService {

    private final ProductRepository productRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ProductManagementService(ProductRepository productRepository,
                                    ApplicationEventPublisher eventPublisher,
                                    Clock clock) {
        this.productRepository = productRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 상품 등록
     *
     * @throws DuplicateBarcodeException 이미 등록된 바코드
     * @throws IllegalArgumentException 이름 누락, 음수 단가/재고
     */
    @Transactional
    public CatalogProduct createProduct(ProductCommand command) {
        if (command.getUnitPrice() == null) {
            throw new IllegalArgumentException("단가는 필수입니다");
        }
        ensureBarcodeAvailable(command.getBarcode(), null);

        Product product = productRepository.save(Product.create(
                command.getName(),
                command.getBarcode(),
                command.getCategoryName(),
                Money.of(command.getUnitPrice()),
                command.getStockQuantity() == null ? 0 : command.getStockQuantity(),
                command.getLowStockThreshold(),
                LocalDateTime.now(clock)
        ));

        log.info("[ProductManagementService] 상품 등록 - productId={}, name={}, barcode={}",
                product.getProductId(), product.getName(), product.getBarcode());
        eventPublisher.publishEvent(new ProductChangedEvent(product.getProductId(), ChangeType.CREATED));
        return CatalogProduct.from(product);
    }

    /**
     * 상품 수정
     *
     * @throws ProductNotFoundException 상품이 없는 경우
     * @throws DuplicateBarcodeException 다른 상품이 쓰는 바코드
     */
    @Transactional
    public CatalogProduct updateProduct(Long productId, ProductCommand command) {
        Integer stockQuantity = command.getStockQuantity();
        if (stockQuantity != null && stockQuantity < 0) {
            throw new IllegalArgumentException("재고는 음수가 될 수 없습니다: " + stockQuantity);
        }
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        ensureBarcodeAvailable(command.getBarcode(), product);

        product.update(
                command.getName(),
                command.getBarcode(),
                command.getCategoryName(),
                command.getUnitPrice() == null ? null : Money.of(command.getUnitPrice()),
                command.getLowStockThreshold(),
                LocalDateTime.now(clock)
        );
        productRepository.save(product);

        if (stockQuantity != null) {
            productRepository.changeStock(productId, stockQuantity);
            log.info("[ProductManagementService] 재고 수량 변경 - productId={}, stock={}", productId, stockQuantity);
        }

        Product updated = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        log.info("[ProductManagementService] 상품 수정 - productId={}", productId);
        eventPublisher.publishEvent(new ProductChangedEvent(productId, ChangeType.UPDATED));
        return CatalogProduct.from(updated);
    }

    /**
     * 상품 삭제 (비활성화)
     *
     * @throws ProductNotFoundException 상품이 없는 경우
     */
    @Transactional
    public void deleteProduct(Long productId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        product.deactivate(LocalDateTime.now(clock));
        productRepository.save(product);

        log.info("[ProductManagementService] 상품 비활성화 - productId={}", productId);
        eventPublisher.publishEvent(new ProductChangedEvent(productId, ChangeType.DELETED));
    }

    private void ensureBarcodeAvailable(String barcode, Product current) {
        if (barcode == null || barcode.isBlank()) {
            return;
        }
        String normalized = barcode.trim();
        if (current != null && Objects.equals(current.getBarcode(), normalized)) {
            return;
        }
        if (productRepository.existsByBarcode(normalized)) {
            throw new DuplicateBarcodeException(normalized);
        }
    }
}
