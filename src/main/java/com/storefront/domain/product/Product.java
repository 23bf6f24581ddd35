package com.storefront.domain.product;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 상품 정보(이름, 설명, 가격, 이미지) 관리
 * - 재고 보유 여부 판단
 *
 * 핵심 비즈니스 규칙:
 * - 상품명은 필수
 * - 가격은 0 이상 MAX_PRICE 이하, 소수점 둘째 자리까지 (NUMERIC(10,2))
 * - 재고는 음수가 될 수 없음 (>= 0)
 *
 * 재고 차감은 엔티티가 아니라 ProductRepository.decrementStock()의 조건부 UPDATE로 처리한다.
 * (SELECT ... FOR UPDATE 로 잠근 행에 대해 stock >= amount 조건을 한 번 더 건다)
 */
@Entity
@Table(name = "products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    /** price 컬럼(NUMERIC(10,2))에 담을 수 있는 최대 가격 */
    public static final BigDecimal MAX_PRICE = new BigDecimal("99999999.99");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "stock", nullable = false)
    private Integer stock;

    @Column(name = "image_url")
    private String imageUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 상품명, 가격, 재고는 필수
     * - 가격과 재고는 0 이상
     */
    public static Product createProduct(String name, String description, BigDecimal price,
                                        Integer stock, String imageUrl) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        validatePrice(price);
        validateStock(stock);

        return Product.builder()
                .name(name)
                .description(description)
                .price(normalize(price))
                .stock(stock)
                .imageUrl(imageUrl)
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 부분 수정
     *
     * null인 필드는 기존 값을 유지한다.
     */
    public void update(String name, String description, BigDecimal price, Integer stock, String imageUrl) {
        if (name != null) {
            if (name.isBlank()) {
                throw new IllegalArgumentException("상품명은 비어 있을 수 없습니다");
            }
            this.name = name;
        }
        if (description != null) {
            this.description = description;
        }
        if (price != null) {
            validatePrice(price);
            this.price = normalize(price);
        }
        if (stock != null) {
            validateStock(stock);
            this.stock = stock;
        }
        if (imageUrl != null) {
            this.imageUrl = imageUrl;
        }
    }

    /**
     * 요청 수량만큼 재고가 있는지 확인
     */
    public boolean hasStockFor(int quantity) {
        return this.stock >= quantity;
    }

    private static void validatePrice(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("가격은 0 이상이어야 합니다");
        }
        if (price.compareTo(MAX_PRICE) > 0) {
            throw new IllegalArgumentException("가격은 " + MAX_PRICE.toPlainString() + " 이하여야 합니다");
        }
        if (price.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("가격은 소수점 둘째 자리까지 입력할 수 있습니다");
        }
    }

    private static void validateStock(Integer stock) {
        if (stock == null || stock < 0) {
            throw new IllegalArgumentException("재고는 0 이상이어야 합니다");
        }
    }

    private static BigDecimal normalize(BigDecimal price) {
        return price.setScale(2, RoundingMode.UNNECESSARY);
    }
}
