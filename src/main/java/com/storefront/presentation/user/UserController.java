package com.storefront.presentation.user;

import com.storefront.application.user.UserService;
import com.storefront.application.user.dto.LoginCommand;
import com.storefront.application.user.dto.RegisterUserCommand;
import com.storefront.application.user.dto.UserInfo;
import com.storefront.infrastructure.security.AuthenticatedUser;
import com.storefront.presentation.common.auth.LoginUser;
import com.storefront.presentation.user.request.LoginRequest;
import com.storefront.presentation.user.request.RegisterRequest;
import com.storefront.presentation.user.response.LoginResponse;
import com.storefront.presentation.user.response.ProfileResponse;
import com.storefront.presentation.user.response.RegisterResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * UserController - Presentation 계층
 * 회원 가입, 로그인, 보호된 경로 확인
 */
@RestController
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    /**
     * POST /register - 회원 가입
     */
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@RequestBody RegisterRequest request) {
        UserInfo userInfo = userService.register(RegisterUserCommand.builder()
                .email(request.getEmail())
                .password(request.getPassword())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RegisterResponse.of("User registered successfully!", userInfo));
    }

    /**
     * POST /login - 로그인 (bearer 토큰 발급)
     */
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@RequestBody LoginRequest request) {
        String token = userService.login(LoginCommand.builder()
                .email(request.getEmail())
                .password(request.getPassword())
                .build());
        return ResponseEntity.ok(new LoginResponse("Login successful!", token));
    }

    /**
     * GET /profile - 보호된 경로
     */
    @GetMapping("/profile")
    public ResponseEntity<ProfileResponse> profile(@LoginUser AuthenticatedUser user) {
        return ResponseEntity.ok(new ProfileResponse("You have access to a protected route!", user));
    }
}
