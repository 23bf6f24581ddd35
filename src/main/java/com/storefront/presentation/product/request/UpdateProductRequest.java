package com.storefront.presentation.product.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 수정 요청 DTO
 * 보낸 필드만 반영한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProductRequest {
    private String name;

    private String description;

    private BigDecimal price;

    private Integer stock;

    @JsonProperty("image_url")
    private String imageUrl;
}
