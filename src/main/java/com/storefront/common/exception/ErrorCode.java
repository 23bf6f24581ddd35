package com.storefront.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 * - 일관된 에러 응답 제공
 *
 * 코드 값은 응답 본문의 error_code로 그대로 노출된다.
 */
public enum ErrorCode {

    // ========== Request Validation (400) ==========

    INVALID_REQUEST("INVALID_REQUEST", "요청 값이 올바르지 않습니다", 400),

    // ========== Authentication (401/403) ==========

    UNAUTHORIZED("UNAUTHORIZED", "인증 토큰이 없습니다", 401),
    FORBIDDEN("FORBIDDEN", "유효하지 않거나 만료된 토큰입니다", 403),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", "이메일 또는 비밀번호가 올바르지 않습니다", 401),

    // ========== Domain Layer Errors (4XX) ==========

    // User Domain
    DUPLICATE_EMAIL("DUPLICATE_EMAIL", "이미 사용 중인 이메일입니다", 409),

    // Product Domain
    PRODUCT_NOT_FOUND("PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    INSUFFICIENT_STOCK("INSUFFICIENT_STOCK", "재고가 부족합니다", 400),

    // Cart Domain
    CART_INVALID_QUANTITY("INVALID_REQUEST", "수량은 1 이상 1000 이하여야 합니다", 400),
    EMPTY_CART("EMPTY_CART", "장바구니가 비어 있습니다", 400),

    // Order Domain
    ORDER_AMOUNT_EXCEEDED("ORDER_AMOUNT_EXCEEDED", "주문 총액이 허용 범위를 초과했습니다", 400),

    // ========== System Errors (5XX) ==========

    CHECKOUT_FAILED("CHECKOUT_FAILED", "결제 처리 중 오류가 발생했습니다", 500),
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
