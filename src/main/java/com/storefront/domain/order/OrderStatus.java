package com.storefront.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 주문 상태 (Enum)
 *
 * 결제가 성공한 시점에 COMPLETED로 생성되며 이후 변경되지 않는다.
 * value는 API 응답에 그대로 노출되는 소문자 표기.
 */
@Getter
public enum OrderStatus {
    COMPLETED("completed", "주문 완료");

    private final String value;
    private final String displayName;

    OrderStatus(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }
}
