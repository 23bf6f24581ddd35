package com.storefront.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 결제 결과 (생성된 주문 ID와 총액)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutResult {
    private Long orderId;
    private BigDecimal totalAmount;
}
