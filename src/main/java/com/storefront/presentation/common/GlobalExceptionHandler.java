package com.storefront.presentation.common;

import com.storefront.common.exception.BizException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.common.exception.SystemException;
import com.storefront.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 역할:
 * - 모든 계층에서 발생하는 예외를 통일된 에러 응답(ErrorResponse)으로 변환
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode에 정의된 상태 코드 (400/401/403/404/409/500)
 * - 잘못된 JSON, 경로 변수 타입 불일치, IllegalArgumentException: 400 INVALID_REQUEST
 * - 그 밖의 예외: 500 INTERNAL_SERVER_ERROR (내부 정보는 응답에 노출하지 않음)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 비즈니스 예외
     *
     * 5XX(SystemException)는 원인 예외 메시지를 숨기고 ErrorCode 메시지만 내려준다.
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        ErrorResponse errorResponse;
        if (e instanceof SystemException) {
            logger.error("[GlobalExceptionHandler] 시스템 예외: code={}", e.getErrorCodeValue(), e);
            errorResponse = ErrorResponse.of(e.getErrorCode());
        } else {
            logger.debug("[GlobalExceptionHandler] 비즈니스 예외: code={}, message={}",
                    e.getErrorCodeValue(), e.getMessage());
            errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 요청 본문 JSON 파싱 실패 (400)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        ErrorResponse errorResponse = ErrorResponse.of(ErrorCode.INVALID_REQUEST.getCode(), "요청 본문을 읽을 수 없습니다");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 경로 변수 / 파라미터 타입 불일치 (400)
     * 예: GET /api/products/abc
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        ErrorResponse errorResponse = ErrorResponse.of(ErrorCode.INVALID_REQUEST.getCode(),
                "잘못된 파라미터 값입니다: " + e.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 엔티티 팩토리/수정 메서드의 입력 검증 실패 (400)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        ErrorResponse errorResponse = ErrorResponse.of(ErrorCode.INVALID_REQUEST.getCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        ErrorResponse errorResponse = ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR.getCode(), "서버 오류가 발생했습니다");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
