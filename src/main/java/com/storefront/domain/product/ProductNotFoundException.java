package com.storefront.domain.product;

import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;
import lombok.Getter;

/**
 * ProductNotFoundException - 상품을 찾을 수 없을 때 발생하는 예외 (Domain 계층)
 *
 * - Error Code: PRODUCT_NOT_FOUND
 * - HTTP Status: 404 Not Found
 */
@Getter
public class ProductNotFoundException extends DomainException {

    private final Long productId;

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
        this.productId = productId;
    }
}
