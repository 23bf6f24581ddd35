package com.storefront.domain.order;

import com.storefront.domain.cart.CartLine;

import java.util.Collection;
import java.util.List;

/**
 * Order Repository Interface (Domain Layer - Port)
 * 주문 데이터의 저장 및 조회를 담당
 */
public interface OrderRepository {

    /**
     * 주문 저장 (CheckoutTransactionService 전용)
     */
    Order save(Order order);

    /**
     * 사용자별 주문 목록 조회 (최신순, 생성 시각이 같으면 ID 내림차순)
     */
    List<Order> findByUserIdNewestFirst(Long userId);

    /**
     * 주문에 묶인 라인 조회 (주문 ID, 라인 ID 오름차순)
     */
    List<CartLine> findItemsByOrderIds(Collection<Long> orderIds);
}
