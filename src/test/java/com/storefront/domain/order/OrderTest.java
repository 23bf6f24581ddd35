package com.storefront.domain.order;

import com.storefront.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Order 도메인 테스트")
class OrderTest {

    @Test
    @DisplayName("완료 주문 생성 - status=completed, 금액 scale 2")
    void createCompletedOrder() {
        Order order = Order.createCompletedOrder(1L, new BigDecimal("51"));

        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(order.getStatus().getValue()).isEqualTo("completed");
        assertThat(order.getTotalAmount()).isEqualTo(new BigDecimal("51.00"));
        assertThat(order.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("주문자 누락 또는 음수 금액은 거절")
    void createCompletedOrder_validation() {
        assertThatThrownBy(() -> Order.createCompletedOrder(null, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Order.createCompletedOrder(1L, new BigDecimal("-0.01")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("총액 상한 - 99999999.99까지 허용, 초과하면 OrderAmountExceededException")
    void createCompletedOrder_totalUpperBound() {
        assertThat(Order.createCompletedOrder(1L, Order.MAX_TOTAL_AMOUNT).getTotalAmount())
                .isEqualTo(new BigDecimal("99999999.99"));

        assertThatThrownBy(() -> Order.createCompletedOrder(1L, new BigDecimal("99999999990.00")))
                .isInstanceOf(OrderAmountExceededException.class)
                .satisfies(e -> assertThat(((OrderAmountExceededException) e).getErrorCode())
                        .isEqualTo(ErrorCode.ORDER_AMOUNT_EXCEEDED));
    }
}
