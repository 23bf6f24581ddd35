package com.storefront.domain.user;

import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;

/**
 * 로그인 실패 예외 (401)
 *
 * 존재하지 않는 이메일과 비밀번호 불일치를 구분하지 않는다.
 */
public class InvalidCredentialsException extends DomainException {

    public InvalidCredentialsException() {
        super(ErrorCode.INVALID_CREDENTIALS);
    }
}
