package com.storefront.domain.cart;

import java.util.List;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface CartRepository {

    CartLine save(CartLine cartLine);

    /**
     * 사용자의 장바구니 라인 조회 (order_id IS NULL, ID 오름차순)
     */
    List<CartLine> findUnassignedByUserId(Long userId);

    /**
     * 비관적 락을 사용하여 사용자의 장바구니 라인 조회
     * 같은 사용자의 결제 요청이 동시에 들어와도 라인이 두 주문에 묶이지 않도록 한다.
     */
    List<CartLine> findUnassignedByUserIdForUpdate(Long userId);

    /**
     * 장바구니 라인을 주문에 묶는다 (CheckoutTransactionService 전용)
     *
     * 아직 order_id가 비어 있는 라인만 갱신한다.
     *
     * @return 실제로 묶인 라인 수
     */
    int bindToOrder(List<Long> cartLineIds, Long orderId);

    /**
     * 상품 삭제 시 해당 상품을 담은 장바구니 라인(order_id IS NULL) 삭제
     * 이미 주문에 묶인 라인은 주문 이력으로 남긴다.
     */
    void deleteUnassignedByProductId(Long productId);
}
