package com.storefront.application.order;

import com.storefront.application.order.dto.OrderInfo;
import com.storefront.application.order.dto.OrderInfo.OrderItemInfo;
import com.storefront.domain.cart.CartLine;
import com.storefront.domain.order.Order;
import com.storefront.domain.order.OrderRepository;
import com.storefront.domain.product.Product;
import com.storefront.domain.product.ProductRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * OrderQueryService - 주문 내역 조회 (읽기 전용)
 *
 * 주문 목록은 최신순(생성 시각 내림차순, 같으면 ID 내림차순)으로 반환하며,
 * 주문 항목과 상품명은 각각 한 번의 IN 쿼리로 모아서 조회한다.
 */
@Service
public class OrderQueryService {

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;

    public OrderQueryService(OrderRepository orderRepository,
                             ProductRepository productRepository) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
    }

    @Transactional(readOnly = true)
    public List<OrderInfo> listForUser(Long userId) {
        List<Order> orders = orderRepository.findByUserIdNewestFirst(userId);
        if (orders.isEmpty()) {
            return Collections.emptyList();
        }

        List<Long> orderIds = orders.stream()
                .map(Order::getOrderId)
                .collect(Collectors.toList());
        List<CartLine> items = orderRepository.findItemsByOrderIds(orderIds);

        Set<Long> productIds = items.stream()
                .map(CartLine::getProductId)
                .collect(Collectors.toSet());
        Map<Long, Product> products = productRepository.findAllByIds(productIds).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        Map<Long, List<OrderItemInfo>> itemsByOrder = items.stream()
                .collect(Collectors.groupingBy(CartLine::getOrderId,
                        Collectors.mapping(line -> OrderItemInfo.from(line, products.get(line.getProductId())),
                                Collectors.toList())));

        return orders.stream()
                .map(order -> OrderInfo.from(order,
                        itemsByOrder.getOrDefault(order.getOrderId(), Collections.emptyList())))
                .collect(Collectors.toList());
    }
}
