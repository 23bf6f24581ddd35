package com.storefront.common.exception;

/**
 * AuthenticationException - 인증 실패 예외
 *
 * - UNAUTHORIZED (401): Authorization 헤더 누락 또는 Bearer 형식이 아님
 * - FORBIDDEN (403): 토큰 서명 불일치 또는 만료
 */
public class AuthenticationException extends BizException {

    public AuthenticationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public AuthenticationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public static AuthenticationException missingToken() {
        return new AuthenticationException(ErrorCode.UNAUTHORIZED);
    }

    public static AuthenticationException invalidToken(Throwable cause) {
        return new AuthenticationException(ErrorCode.FORBIDDEN, cause);
    }
}
