package com.storefront.presentation.product.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품 등록/수정 응답
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductMutationResponse {
    private String message;
    private ProductResponse product;
}
