package com.storefront.infrastructure.persistence.order;

import com.storefront.domain.order.Order;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Order JPA Repository
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    List<Order> findByUserIdOrderByCreatedAtDescOrderIdDesc(Long userId);
}
