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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * UserService - 회원 가입 / 로그인 (Application 계층)
 *
 * - 비밀번호는 PasswordHasher(BCrypt)로 해시해서만 저장
 * - 로그인 실패 시 이메일 존재 여부와 관계없이 같은 응답을 준다
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenProvider jwtTokenProvider;

    public UserService(UserRepository userRepository,
                       PasswordHasher passwordHasher,
                       JwtTokenProvider jwtTokenProvider) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.jwtTokenProvider = jwtTokenProvider;
    }

    @Transactional
    public UserInfo register(RegisterUserCommand command) {
        validateCredentials(command.getEmail(), command.getPassword());

        if (userRepository.existsByEmail(command.getEmail())) {
            throw new DuplicateEmailException(command.getEmail());
        }

        User user = User.createUser(command.getEmail(), passwordHasher.hash(command.getPassword()));
        User saved = userRepository.save(user);

        log.info("[UserService] 회원 가입: userId={}", saved.getUserId());
        return UserInfo.from(saved);
    }

    /**
     * 로그인
     *
     * @return 서명된 bearer 토큰
     * @throws InvalidCredentialsException 이메일이 없거나 비밀번호가 틀린 경우
     */
    @Transactional(readOnly = true)
    public String login(LoginCommand command) {
        validateCredentials(command.getEmail(), command.getPassword());

        User user = userRepository.findByEmail(command.getEmail())
                .orElseThrow(InvalidCredentialsException::new);

        if (!passwordHasher.matches(command.getPassword(), user.getPasswordHash())) {
            log.warn("[UserService] 로그인 실패: userId={}", user.getUserId());
            throw new InvalidCredentialsException();
        }

        return jwtTokenProvider.issue(user.getUserId(), user.getEmail());
    }

    private void validateCredentials(String email, String password) {
        if (email == null || email.isBlank() || password == null || password.isBlank()) {
            throw new DomainException(ErrorCode.INVALID_REQUEST, "email과 password는 필수입니다");
        }
    }
}
