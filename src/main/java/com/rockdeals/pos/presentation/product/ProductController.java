package com.rockdeals.pos.presentation.product;

import com.rockdeals.pos.application.product.ProductCatalogService;
import com.rockdeals.pos.application.product.ProductManagementService;
import com.rockdeals.pos.domain.product.ProductSearchCondition;
import com.rockdeals.pos.presentation.product.request.ProductRequest;
import com.rockdeals.pos.presentation.product.response.ProductListResponse;
import com.rockdeals.pos.presentation.product.response.ProductResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * ProductController - POS 카탈로그/상품 관리 API
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductCatalogService productCatalogService;
    private final ProductManagementService productManagementService;

    public ProductController(ProductCatalogService productCatalogService,
                             ProductManagementService productManagementService) {
        this.productCatalogService = productCatalogService;
        this.productManagementService = productManagementService;
    }

    /**
     * GET /products?search=&category=&limit= - 활성 상품 검색
     */
    @GetMapping
    public ResponseEntity<ProductListResponse> listProducts(
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "limit", required = false) Integer limit) {
        ProductSearchCondition condition = ProductSearchCondition.of(search, category, limit);
        return ResponseEntity.ok(ProductListResponse.from(productCatalogService.listProducts(condition)));
    }

    /**
     * GET /products/low-stock?limit= - 저재고 상품 목록
     */
    @GetMapping("/low-stock")
    public ResponseEntity<ProductListResponse> listLowStockProducts(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(ProductListResponse.from(productCatalogService.listLowStockProducts(limit)));
    }

    /**
     * POST /products - 상품 등록
     */
    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(@RequestBody ProductRequest request) {
        ProductResponse response = ProductResponse.from(productManagementService.createProduct(request.toCommand()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * PUT /products/{product_id} - 상품 수정 (생략한 필드는 유지)
     */
    @PutMapping("/{product_id}")
    public ResponseEntity<ProductResponse> updateProduct(@PathVariable("product_id") Long productId,
                                                         @RequestBody ProductRequest request) {
        return ResponseEntity.ok(ProductResponse.from(
                productManagementService.updateProduct(productId, request.toCommand())));
    }

    /**
     * DELETE /products/{product_id} - 상품 삭제 (비활성화)
     */
    @DeleteMapping("/{product_id}")
    public ResponseEntity<Void> deleteProduct(@PathVariable("product_id") Long productId) {
        productManagementService.deleteProduct(productId);
        return ResponseEntity.noContent().build();
    }
}
