package com.storefront.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 역할:
 * - 데이터베이스 연결, 락 획득 실패 등 인프라 오류
 * - 예측 불가능한 시스템 오류
 * - 항상 서버 오류(5XX)로 응답하며, 원인은 로그에만 남기고 클라이언트에 노출하지 않음
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
