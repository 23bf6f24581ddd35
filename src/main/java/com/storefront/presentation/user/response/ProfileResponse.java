package com.storefront.presentation.user.response;

import com.storefront.infrastructure.security.AuthenticatedUser;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 보호된 경로 응답 (검증된 토큰의 사용자 정보를 그대로 돌려준다)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {
    private String message;
    private AuthenticatedUser user;
}
