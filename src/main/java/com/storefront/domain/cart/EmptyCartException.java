package com.storefront.domain.cart;

import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;

/**
 * 주문에 묶이지 않은 장바구니 라인이 하나도 없는 상태에서 결제를 요청했을 때 발생 (400)
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(Long userId) {
        super(ErrorCode.EMPTY_CART, "userId=" + userId);
    }
}
