package com.storefront.presentation.user.response;

import com.storefront.application.user.dto.UserInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 회원 가입 응답
 * { "message": "...", "user": { "id": 1, "email": "..." } }
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterResponse {
    private String message;
    private RegisteredUser user;

    public static RegisterResponse of(String message, UserInfo userInfo) {
        return RegisterResponse.builder()
                .message(message)
                .user(new RegisteredUser(userInfo.getUserId(), userInfo.getEmail()))
                .build();
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RegisteredUser {
        private Long id;
        private String email;
    }
}
