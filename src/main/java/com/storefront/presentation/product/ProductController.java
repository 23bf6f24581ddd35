package com.storefront.presentation.product;

import com.storefront.application.product.ProductService;
import com.storefront.application.product.dto.ProductInfo;
import com.storefront.infrastructure.security.AuthenticatedUser;
import com.storefront.presentation.common.auth.LoginUser;
import com.storefront.presentation.product.mapper.ProductMapper;
import com.storefront.presentation.product.request.CreateProductRequest;
import com.storefront.presentation.product.request.UpdateProductRequest;
import com.storefront.presentation.product.response.DeleteProductResponse;
import com.storefront.presentation.product.response.ProductMutationResponse;
import com.storefront.presentation.product.response.ProductResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * ProductController - Presentation 계층
 * 상품 조회는 공개, 등록/수정/삭제는 bearer 토큰 필요
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductService productService;
    private final ProductMapper productMapper;

    public ProductController(ProductService productService, ProductMapper productMapper) {
        this.productService = productService;
        this.productMapper = productMapper;
    }

    /**
     * GET /products - 상품 목록 조회
     */
    @GetMapping
    public ResponseEntity<List<ProductResponse>> getProducts() {
        return ResponseEntity.ok(productMapper.toProductResponses(productService.getProducts()));
    }

    /**
     * GET /products/{productId} - 상품 상세 조회
     */
    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("productId") Long productId) {
        return ResponseEntity.ok(productMapper.toProductResponse(productService.getProduct(productId)));
    }

    /**
     * POST /products - 상품 등록
     */
    @PostMapping
    public ResponseEntity<ProductMutationResponse> createProduct(
            @LoginUser AuthenticatedUser user,
            @RequestBody CreateProductRequest request) {
        ProductInfo created = productService.createProduct(user.getUserId(), productMapper.toCreateCommand(request));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ProductMutationResponse("Product added successfully!", productMapper.toProductResponse(created)));
    }

    /**
     * PUT /products/{productId} - 상품 부분 수정
     */
    @PutMapping("/{productId}")
    public ResponseEntity<ProductMutationResponse> updateProduct(
            @LoginUser AuthenticatedUser user,
            @PathVariable("productId") Long productId,
            @RequestBody UpdateProductRequest request) {
        ProductInfo updated = productService.updateProduct(user.getUserId(), productId, productMapper.toUpdateCommand(request));
        return ResponseEntity.ok(
                new ProductMutationResponse("Product updated successfully!", productMapper.toProductResponse(updated)));
    }

    /**
     * DELETE /products/{productId} - 상품 삭제
     */
    @DeleteMapping("/{productId}")
    public ResponseEntity<DeleteProductResponse> deleteProduct(
            @LoginUser AuthenticatedUser user,
            @PathVariable("productId") Long productId) {
        Long deletedId = productService.deleteProduct(user.getUserId(), productId);
        return ResponseEntity.ok(new DeleteProductResponse("Product deleted successfully!", deletedId));
    }
}
