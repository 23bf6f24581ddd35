package com.storefront.presentation.product.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 상품 등록 요청 DTO
 * name, price, stock 필수
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateProductRequest {
    private String name;

    private String description;

    private BigDecimal price;

    private Integer stock;

    @JsonProperty("image_url")
    private String imageUrl;
}
