package com.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.storefront.application.cart.dto.CartLineInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 라인 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineResponse {
    @JsonProperty("id")
    private Long cartLineId;

    @JsonProperty("product_id")
    private Long productId;

    private Integer quantity;

    private BigDecimal price;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("image_url")
    private String imageUrl;

    public static CartLineResponse from(CartLineInfo info) {
        return CartLineResponse.builder()
                .cartLineId(info.getCartLineId())
                .productId(info.getProductId())
                .quantity(info.getQuantity())
                .price(info.getPrice())
                .productName(info.getProductName())
                .imageUrl(info.getImageUrl())
                .build();
    }
}
