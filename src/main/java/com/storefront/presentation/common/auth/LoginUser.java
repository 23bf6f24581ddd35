package com.storefront.presentation.common.auth;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 인증된 사용자를 주입받는 컨트롤러 파라미터 표시
 *
 * 사용 예:
 * public ResponseEntity<...> getCart(@LoginUser AuthenticatedUser user)
 *
 * 이 파라미터가 있는 핸들러는 Authorization: Bearer 헤더가 필수다.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface LoginUser {
}
