package com.storefront.domain.order;

import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * 주문 총액이 total_amount 컬럼 범위(Order.MAX_TOTAL_AMOUNT)를 넘을 때 발생 (400)
 */
public class OrderAmountExceededException extends DomainException {

    public OrderAmountExceededException(Long userId, BigDecimal totalAmount) {
        super(ErrorCode.ORDER_AMOUNT_EXCEEDED,
                "userId=" + userId + ", totalAmount=" + totalAmount.toPlainString());
    }
}
