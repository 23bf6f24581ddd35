package com.storefront.application.order.dto;

import com.storefront.domain.cart.CartLine;
import com.storefront.domain.order.Order;
import com.storefront.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 내역 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderInfo {
    private Long orderId;
    private BigDecimal totalAmount;
    private String status;
    private LocalDateTime createdAt;
    private List<OrderItemInfo> items;

    public static OrderInfo from(Order order, List<OrderItemInfo> items) {
        return OrderInfo.builder()
                .orderId(order.getOrderId())
                .totalAmount(order.getTotalAmount())
                .status(order.getStatus().getValue())
                .createdAt(order.getCreatedAt())
                .items(items)
                .build();
    }

    /**
     * 주문 항목 (주문에 묶인 장바구니 라인)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderItemInfo {
        private Long productId;
        private String productName;
        private Integer quantity;
        private BigDecimal price;

        public static OrderItemInfo from(CartLine line, Product product) {
            return OrderItemInfo.builder()
                    .productId(line.getProductId())
                    .productName(product != null ? product.getName() : null)
                    .quantity(line.getQuantity())
                    .price(line.getUnitPrice())
                    .build();
        }
    }
}
