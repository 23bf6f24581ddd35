package com.storefront.domain.user;

import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;

/**
 * 이미 가입된 이메일로 회원가입을 시도할 때 발생하는 예외 (409)
 */
public class DuplicateEmailException extends DomainException {

    public DuplicateEmailException(String email) {
        super(ErrorCode.DUPLICATE_EMAIL, "email=" + email);
    }

    public DuplicateEmailException(String email, Throwable cause) {
        this(email);
        initCause(cause);
    }
}
