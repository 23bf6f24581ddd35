package com.storefront.infrastructure.persistence.order;

import com.storefront.domain.cart.CartLine;
import com.storefront.domain.order.Order;
import com.storefront.domain.order.OrderRepository;
import com.storefront.infrastructure.persistence.cart.CartLineJpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * MySQL 기반 Order Repository 구현
 *
 * 주문 항목은 별도 테이블이 아니라 order_id가 채워진 order_items 행이므로
 * CartLineJpaRepository를 함께 사용한다.
 */
@Repository
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;
    private final CartLineJpaRepository cartLineJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository,
                                CartLineJpaRepository cartLineJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
        this.cartLineJpaRepository = cartLineJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public List<Order> findByUserIdNewestFirst(Long userId) {
        return orderJpaRepository.findByUserIdOrderByCreatedAtDescOrderIdDesc(userId);
    }

    @Override
    public List<CartLine> findItemsByOrderIds(Collection<Long> orderIds) {
        if (orderIds.isEmpty()) {
            return List.of();
        }
        return cartLineJpaRepository.findByOrderIdInOrderByOrderIdAscCartLineIdAsc(orderIds);
    }
}
