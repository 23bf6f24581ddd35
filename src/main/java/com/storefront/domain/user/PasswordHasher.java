package com.storefront.domain.user;

/**
 * 단방향 비밀번호 해시 (Domain Layer - Port)
 */
public interface PasswordHasher {

    String hash(String plainPassword);

    boolean matches(String plainPassword, String passwordHash);
}
