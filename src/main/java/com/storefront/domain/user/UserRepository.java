package com.storefront.domain.user;

import java.util.Optional;

/**
 * User Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface UserRepository {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    /**
     * 사용자 저장
     *
     * @return 식별자가 채워진 사용자
     * @throws DuplicateEmailException 동시 가입으로 unique 제약을 위반한 경우
     */
    User save(User user);
}
