package com.rockdeals.pos.infrastructure.persistence.product;

import com.rockdeals.pos.domain.product.Product;
import com.rockdeals.pos.domain.product.ProductRepository;
import com.rockdeals.pos.domain.product.ProductSearchCondition;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 *
 * Port(ProductRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public Optional<Product> findByBarcode(String barcode) {
        return productJpaRepository.findByBarcode(barcode);
    }

    @Override
    public List<Product> findAllById(Collection<Long> productIds) {
        return productJpaRepository.findAllById(productIds);
    }

    @Override
    public List<Product> search(ProductSearchCondition condition) {
        return productJpaRepository.search(
                condition.getSearch(),
                condition.getCategoryName(),
                PageRequest.of(0, condition.getLimit())
        );
    }

    @Override
    public int decreaseStock(Long productId, int quantity) {
        return productJpaRepository.decreaseStock(productId, quantity, LocalDateTime.now());
    }

    @Override
    public int increaseStock(Long productId, int quantity) {
        return productJpaRepository.increaseStock(productId, quantity, LocalDateTime.now());
    }

    @Override
    public int changeStock(Long productId, int stockQuantity) {
        return productJpaRepository.changeStock(productId, stockQuantity, LocalDateTime.now());
    }

    @Override
    public List<Product> findLowStock(int limit) {
        return productJpaRepository.findLowStock(PageRequest.of(0, limit));
    }

    @Override
    public boolean existsByBarcode(String barcode) {
        return productJpaRepository.existsByBarcode(barcode);
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }
}
