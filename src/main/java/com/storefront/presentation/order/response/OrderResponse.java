package com.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storefront.application.order.dto.OrderInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 내역 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {
    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    private String status;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    private List<OrderItemResponse> items;

    public static OrderResponse from(OrderInfo info) {
        return OrderResponse.builder()
                .orderId(info.getOrderId())
                .totalAmount(info.getTotalAmount())
                .status(info.getStatus())
                .createdAt(info.getCreatedAt())
                .items(info.getItems().stream()
                        .map(item -> OrderItemResponse.builder()
                                .productId(item.getProductId())
                                .name(item.getProductName())
                                .quantity(item.getQuantity())
                                .price(item.getPrice())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * 주문 항목 (price는 담을 당시 단가)
     */
    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderItemResponse {
        @JsonProperty("product_id")
        private Long productId;

        private String name;

        private Integer quantity;

        private BigDecimal price;
    }
}
