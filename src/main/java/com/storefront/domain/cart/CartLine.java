package com.storefront.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * CartLine 도메인 엔티티
 *
 * 장바구니 한 줄(상품 + 수량 + 담을 당시 단가)을 표현한다.
 * 별도의 장바구니 테이블 없이 order_id가 비어 있는 행이 곧 "장바구니에 담긴 상태"이며,
 * 결제가 끝나면 같은 행이 주문 항목이 된다 (행 복사 없음).
 *
 * 핵심 비즈니스 규칙:
 * - 수량은 1 이상 1000 이하
 * - 단가는 담는 시점의 상품 가격 스냅샷이며, 이후 상품 가격이 바뀌어도 결제 금액은 스냅샷 기준
 * - order_id는 null → 주문 ID로 한 번만 바뀐다 (CheckoutTransactionService 전용)
 * - 소유자(user_id)를 명시해서 장바구니가 사용자별로 분리된다
 */
@Entity
@Table(name = "order_items", indexes = {
    @Index(name = "idx_order_items_user_order", columnList = "user_id, order_id"),
    @Index(name = "idx_order_items_order", columnList = "order_id"),
    @Index(name = "idx_order_items_product", columnList = "product_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long cartLineId;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 장바구니 라인 생성 팩토리 메서드
     *
     * @param userId 장바구니 소유자
     * @param productId 상품 ID
     * @param quantity 수량 (1~1000)
     * @param unitPrice 담는 시점의 상품 가격
     * @throws InvalidQuantityException 수량 범위 위반
     */
    public static CartLine createLine(Long userId, Long productId, Integer quantity, BigDecimal unitPrice) {
        if (quantity == null
                || quantity < CartConstants.MIN_CART_QUANTITY
                || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("단가는 0 이상이어야 합니다");
        }

        return CartLine.builder()
                .userId(userId)
                .productId(productId)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 아직 주문에 묶이지 않은 라인인지
     */
    public boolean isInCart() {
        return this.orderId == null;
    }

    /**
     * 라인 소계 (단가 × 수량)
     */
    public BigDecimal getLineTotal() {
        return this.unitPrice.multiply(BigDecimal.valueOf(this.quantity));
    }
}
