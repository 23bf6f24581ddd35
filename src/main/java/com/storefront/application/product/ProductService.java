package com.storefront.application.product;

import com.storefront.application.product.dto.CreateProductCommand;
import com.storefront.application.product.dto.ProductInfo;
import com.storefront.application.product.dto.UpdateProductCommand;
import com.storefront.domain.cart.CartRepository;
import com.storefront.domain.product.Product;
import com.storefront.domain.product.ProductNotFoundException;
import com.storefront.domain.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductService - 상품 CRUD (Application 계층)
 *
 * 아키텍처:
 * - Domain 계층의 ProductRepository 인터페이스에만 의존 (Port)
 * - 입력 검증은 Product 팩토리/수정 메서드가 담당 (IllegalArgumentException → 400)
 */
@Service
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final CartRepository cartRepository;

    public ProductService(ProductRepository productRepository,
                          CartRepository cartRepository) {
        this.productRepository = productRepository;
        this.cartRepository = cartRepository;
    }

    @Transactional(readOnly = true)
    public List<ProductInfo> getProducts() {
        return productRepository.findAll().stream()
                .map(ProductInfo::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ProductInfo getProduct(Long productId) {
        return ProductInfo.from(findProduct(productId));
    }

    @Transactional
    public ProductInfo createProduct(Long userId, CreateProductCommand command) {
        Product product = Product.createProduct(
                command.getName(),
                command.getDescription(),
                command.getPrice(),
                command.getStock(),
                command.getImageUrl());

        Product saved = productRepository.save(product);
        log.info("[ProductService] 상품 등록: userId={}, productId={}", userId, saved.getProductId());
        return ProductInfo.from(saved);
    }

    @Transactional
    public ProductInfo updateProduct(Long userId, Long productId, UpdateProductCommand command) {
        Product product = findProduct(productId);
        product.update(
                command.getName(),
                command.getDescription(),
                command.getPrice(),
                command.getStock(),
                command.getImageUrl());

        Product saved = productRepository.save(product);
        log.info("[ProductService] 상품 수정: userId={}, productId={}", userId, productId);
        return ProductInfo.from(saved);
    }

    /**
     * 상품 삭제
     * 상품을 담은 장바구니 라인은 함께 삭제된다.
     * 주문에 묶인 라인은 그대로 남아 주문 총액과 항목 합계가 계속 일치한다.
     * (주문 내역에서 삭제된 상품의 이름은 null)
     *
     * @return 삭제된 상품 ID
     */
    @Transactional
    public Long deleteProduct(Long userId, Long productId) {
        Product product = findProduct(productId);
        cartRepository.deleteUnassignedByProductId(productId);
        productRepository.delete(product);
        log.info("[ProductService] 상품 삭제: userId={}, productId={}", userId, productId);
        return productId;
    }

    private Product findProduct(Long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }
}
