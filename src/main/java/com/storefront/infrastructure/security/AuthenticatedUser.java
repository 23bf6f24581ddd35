package com.storefront.infrastructure.security;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 검증된 Bearer 토큰에서 꺼낸 사용자 식별 정보
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class AuthenticatedUser {
    private final Long userId;
    private final String email;
}
