package com.storefront.application.cart.dto;

import com.storefront.domain.cart.CartLine;
import com.storefront.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 라인 조회 결과
 * 단가는 담을 당시의 스냅샷이고, 상품명과 이미지는 현재 상품 정보다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineInfo {
    private Long cartLineId;
    private Long productId;
    private Integer quantity;
    private BigDecimal price;
    private String productName;
    private String imageUrl;

    public static CartLineInfo from(CartLine line, Product product) {
        return CartLineInfo.builder()
                .cartLineId(line.getCartLineId())
                .productId(line.getProductId())
                .quantity(line.getQuantity())
                .price(line.getUnitPrice())
                .productName(product != null ? product.getName() : null)
                .imageUrl(product != null ? product.getImageUrl() : null)
                .build();
    }
}
