package com.storefront.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Order 도메인 엔티티
 *
 * 책임:
 * - 결제 1회의 결과(소유자, 총액, 상태, 생성 시각) 보관
 *
 * 핵심 비즈니스 규칙:
 * - 결제가 성공할 때마다 정확히 한 건 생성되고 이후 수정되지 않는다 (불변 이력)
 * - 주문 항목은 order_id가 이 주문으로 묶인 CartLine 행들이다
 * - 총액은 0 이상 MAX_TOTAL_AMOUNT 이하, 소수점 둘째 자리까지
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user_created", columnList = "user_id, created_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    /** total_amount 컬럼(NUMERIC(10,2))에 담을 수 있는 최대 금액 */
    public static final BigDecimal MAX_TOTAL_AMOUNT = new BigDecimal("99999999.99");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long orderId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "status", nullable = false, updatable = false, length = 50)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 완료된 주문 생성 팩토리 메서드
     *
     * @param userId 주문자
     * @param totalAmount Σ(수량 × 단가 스냅샷)
     * @throws OrderAmountExceededException 총액이 MAX_TOTAL_AMOUNT를 넘는 경우
     */
    public static Order createCompletedOrder(Long userId, BigDecimal totalAmount) {
        if (userId == null) {
            throw new IllegalArgumentException("주문자는 필수입니다");
        }
        if (totalAmount == null || totalAmount.signum() < 0) {
            throw new IllegalArgumentException("주문 금액은 음수가 될 수 없습니다");
        }
        if (totalAmount.compareTo(MAX_TOTAL_AMOUNT) > 0) {
            throw new OrderAmountExceededException(userId, totalAmount);
        }

        return Order.builder()
                .userId(userId)
                .totalAmount(totalAmount.setScale(2, RoundingMode.UNNECESSARY))
                .status(OrderStatus.COMPLETED)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
