package com.storefront.domain.product;

import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;
import lombok.Getter;

/**
 * InsufficientStockException - 재고 부족 예외
 *
 * 결제 시 요청 수량이 현재 재고보다 많을 때 발생한다.
 * 사용자가 조치할 수 있는 비즈니스 거절이며 400으로 응답한다.
 */
@Getter
public class InsufficientStockException extends DomainException {

    private final Long productId;

    public InsufficientStockException(Long productId) {
        super(ErrorCode.INSUFFICIENT_STOCK, "productId=" + productId);
        this.productId = productId;
    }

    public InsufficientStockException(Long productId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("productId=%d, 요청=%d, 보유=%d", productId, requested, available));
        this.productId = productId;
    }
}
