package com.storefront.infrastructure.persistence.user;

import com.storefront.domain.user.DuplicateEmailException;
import com.storefront.domain.user.User;
import com.storefront.domain.user.UserRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 User Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 */
@Repository
public class MySQLUserRepository implements UserRepository {

    private final UserJpaRepository userJpaRepository;

    public MySQLUserRepository(UserJpaRepository userJpaRepository) {
        this.userJpaRepository = userJpaRepository;
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return userJpaRepository.findByEmail(email);
    }

    @Override
    public boolean existsByEmail(String email) {
        return userJpaRepository.existsByEmail(email);
    }

    /**
     * 사용자 저장
     *
     * existsByEmail() 확인과 INSERT 사이에 같은 이메일로 가입한 요청이 있으면
     * unique 제약 위반이 발생하므로 도메인 예외로 변환한다.
     */
    @Override
    public User save(User user) {
        try {
            return userJpaRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateEmailException(user.getEmail(), e);
        }
    }
}
