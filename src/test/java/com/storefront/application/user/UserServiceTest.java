package com.storefront.application.user;

import com.storefront.application.user.dto.LoginCommand;
import com.storefront.application.user.dto.RegisterUserCommand;
import com.storefront.application.user.dto.UserInfo;
import com.storefront.common.exception.DomainException;
import com.storefront.common.exception.ErrorCode;
import com.storefront.domain.user.DuplicateEmailException;
import com.storefront.domain.user.InvalidCredentialsException;
import com.storefront.domain.user.PasswordHasher;
import com.storefront.domain.user.User;
import com.storefront.domain.user.UserRepository;
import com.storefront.infrastructure.security.JwtTokenProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService 단위 테스트")
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordHasher passwordHasher;

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    @InjectMocks
    private UserService userService;

    private static User storedUser() {
        return User.builder()
                .userId(3L)
                .email("buyer@example.com")
                .passwordHash("$2a$10$hash")
                .createdAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("회원 가입 - 비밀번호는 해시로 저장")
    void register_success() {
        // Given
        when(userRepository.existsByEmail("buyer@example.com")).thenReturn(false);
        when(passwordHasher.hash("secret")).thenReturn("$2a$10$hash");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User user = invocation.getArgument(0);
            return User.builder().userId(3L).email(user.getEmail()).passwordHash(user.getPasswordHash()).build();
        });

        // When
        UserInfo result = userService.register(new RegisterUserCommand("buyer@example.com", "secret"));

        // Then
        assertThat(result.getUserId()).isEqualTo(3L);
        assertThat(result.getEmail()).isEqualTo("buyer@example.com");

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertThat(captor.getValue().getPasswordHash()).isEqualTo("$2a$10$hash");
        assertThat(captor.getValue().isAdmin()).isFalse();
    }

    @Test
    @DisplayName("회원 가입 - 이메일 중복이면 DuplicateEmailException (409)")
    void register_duplicateEmail() {
        when(userRepository.existsByEmail("buyer@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.register(new RegisterUserCommand("buyer@example.com", "secret")))
                .isInstanceOf(DuplicateEmailException.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("회원 가입 - 비밀번호 누락이면 INVALID_REQUEST")
    void register_missingPassword() {
        assertThatThrownBy(() -> userService.register(new RegisterUserCommand("buyer@example.com", " ")))
                .isInstanceOf(DomainException.class)
                .satisfies(e -> assertThat(((DomainException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_REQUEST));
        verifyNoInteractions(userRepository, passwordHasher);
    }

    @Test
    @DisplayName("로그인 - 성공 시 토큰 발급")
    void login_success() {
        when(userRepository.findByEmail("buyer@example.com")).thenReturn(Optional.of(storedUser()));
        when(passwordHasher.matches("secret", "$2a$10$hash")).thenReturn(true);
        when(jwtTokenProvider.issue(3L, "buyer@example.com")).thenReturn("token");

        assertThat(userService.login(new LoginCommand("buyer@example.com", "secret"))).isEqualTo("token");
    }

    @Test
    @DisplayName("로그인 - 없는 이메일과 틀린 비밀번호는 같은 예외")
    void login_invalidCredentials() {
        when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());
        when(userRepository.findByEmail("buyer@example.com")).thenReturn(Optional.of(storedUser()));
        when(passwordHasher.matches("wrong", "$2a$10$hash")).thenReturn(false);

        assertThatThrownBy(() -> userService.login(new LoginCommand("nobody@example.com", "secret")))
                .isInstanceOf(InvalidCredentialsException.class);
        assertThatThrownBy(() -> userService.login(new LoginCommand("buyer@example.com", "wrong")))
                .isInstanceOf(InvalidCredentialsException.class);
        verifyNoInteractions(jwtTokenProvider);
    }
}
