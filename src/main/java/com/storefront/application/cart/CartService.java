package com.storefront.application.cart;

import com.storefront.application.cart.dto.AddCartLineCommand;
import com.storefront.application.cart.dto.CartLineInfo;
import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.domain.cart.CartLine;
import com.storefront.domain.cart.CartRepository;
import com.storefront.domain.product.Product;
import com.storefront.domain.product.ProductNotFoundException;
import com.storefront.domain.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CartService - Application 계층
 *
 * 장바구니 = 사용자의 order_id가 비어 있는 라인 목록.
 * 같은 상품을 여러 번 담으면 라인이 각각 추가된다 (수량 병합 없음).
 */
@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;

    public CartService(CartRepository cartRepository,
                       ProductRepository productRepository) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
    }

    /**
     * 장바구니에 라인 추가
     * 현재 상품 가격을 단가 스냅샷으로 저장한다.
     */
    @Transactional
    public CartLineInfo addLine(Long userId, AddCartLineCommand command) {
        if (command.getProductId() == null || command.getQuantity() == null) {
            throw new DomainException(ErrorCode.INVALID_REQUEST, "product_id와 quantity는 필수입니다");
        }

        Product product = productRepository.findById(command.getProductId())
                .orElseThrow(() -> new ProductNotFoundException(command.getProductId()));

        CartLine line = CartLine.createLine(userId, product.getProductId(), command.getQuantity(), product.getPrice());
        CartLine saved = cartRepository.save(line);

        log.info("[CartService] 장바구니 추가: userId={}, productId={}, quantity={}",
                userId, product.getProductId(), command.getQuantity());
        return CartLineInfo.from(saved, product);
    }

    @Transactional(readOnly = true)
    public List<CartLineInfo> getCart(Long userId) {
        List<CartLine> lines = cartRepository.findUnassignedByUserId(userId);
        if (lines.isEmpty()) {
            return Collections.emptyList();
        }

        Set<Long> productIds = lines.stream()
                .map(CartLine::getProductId)
                .collect(Collectors.toSet());
        Map<Long, Product> products = productRepository.findAllByIds(productIds).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        return lines.stream()
                .map(line -> CartLineInfo.from(line, products.get(line.getProductId())))
                .collect(Collectors.toList());
    }
}
