package com.storefront.application.order;

import com.storefront.application.order.dto.CheckoutResult;
import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.common.exception.SystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * CheckoutService - 결제 진입점 (Application 계층)
 *
 * 역할:
 * - 실제 트랜잭션은 CheckoutTransactionService에 위임
 * - 비즈니스 거절(빈 장바구니, 재고 부족, 상품 없음)은 그대로 전파
 * - 그 밖의 예외는 내부 정보를 숨기고 CHECKOUT_FAILED로 변환
 *
 * 이 시점에는 트랜잭션이 이미 롤백되어 있다.
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final CheckoutTransactionService checkoutTransactionService;

    public CheckoutService(CheckoutTransactionService checkoutTransactionService) {
        this.checkoutTransactionService = checkoutTransactionService;
    }

    public CheckoutResult checkout(Long userId) {
        try {
            return checkoutTransactionService.checkout(userId);
        } catch (DomainException e) {
            log.info("[CheckoutService] 결제 거절: userId={}, code={}", userId, e.getErrorCodeValue());
            throw e;
        } catch (Exception e) {
            log.error("[CheckoutService] 결제 실패: userId={}", userId, e);
            throw new SystemException(ErrorCode.CHECKOUT_FAILED, e);
        }
    }
}
