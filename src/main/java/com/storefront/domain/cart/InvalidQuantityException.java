package com.storefront.domain.cart;

import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;

/**
 * 유효하지 않은 수량일 때 발생하는 예외
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(Integer quantity) {
        super(ErrorCode.CART_INVALID_QUANTITY, "입력값: " + quantity);
    }
}
