package com.storefront.infrastructure.persistence.cart;

import com.storefront.domain.cart.CartLine;
import com.storefront.domain.cart.CartRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * MySQL 기반 Cart Repository 구현
 *
 * 장바구니 = order_items 중 order_id IS NULL 인 행
 */
@Repository
public class MySQLCartRepository implements CartRepository {

    private static final Logger log = LoggerFactory.getLogger(MySQLCartRepository.class);

    private final CartLineJpaRepository cartLineJpaRepository;

    public MySQLCartRepository(CartLineJpaRepository cartLineJpaRepository) {
        this.cartLineJpaRepository = cartLineJpaRepository;
    }

    @Override
    public CartLine save(CartLine cartLine) {
        return cartLineJpaRepository.save(cartLine);
    }

    @Override
    public List<CartLine> findUnassignedByUserId(Long userId) {
        return cartLineJpaRepository.findByUserIdAndOrderIdIsNullOrderByCartLineIdAsc(userId);
    }

    @Override
    public List<CartLine> findUnassignedByUserIdForUpdate(Long userId) {
        return cartLineJpaRepository.findUnassignedByUserIdForUpdate(userId);
    }

    @Override
    public int bindToOrder(List<Long> cartLineIds, Long orderId) {
        if (cartLineIds.isEmpty()) {
            return 0;
        }
        return cartLineJpaRepository.bindToOrder(cartLineIds, orderId);
    }

    @Override
    public void deleteUnassignedByProductId(Long productId) {
        int deleted = cartLineJpaRepository.deleteUnassignedByProductId(productId);
        log.info("[MySQLCartRepository] 상품 삭제에 따른 장바구니 라인 삭제: productId={}, deleted={}", productId, deleted);
    }
}
