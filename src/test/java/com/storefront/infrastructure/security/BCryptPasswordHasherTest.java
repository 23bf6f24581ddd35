package com.storefront.infrastructure.security;

import com.storefront.infrastructure.config.StorefrontProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BCryptPasswordHasher 테스트")
class BCryptPasswordHasherTest {

    private BCryptPasswordHasher hasher;

    @BeforeEach
    void setUp() {
        StorefrontProperties properties = new StorefrontProperties();
        properties.getSecurity().setBcryptCost(4);
        hasher = new BCryptPasswordHasher(properties);
    }

    @Test
    @DisplayName("해시는 평문과 다르고 매번 솔트가 달라진다")
    void hash_saltedAndOneWay() {
        String first = hasher.hash("secret");
        String second = hasher.hash("secret");

        assertThat(first).isNotEqualTo("secret").startsWith("$2a$04$");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("일치 여부 확인")
    void matches() {
        String hash = hasher.hash("secret");

        assertThat(hasher.matches("secret", hash)).isTrue();
        assertThat(hasher.matches("wrong", hash)).isFalse();
    }

    @Test
    @DisplayName("BCrypt 형식이 아닌 해시는 불일치")
    void matches_invalidHash() {
        assertThat(hasher.matches("secret", "plain-text")).isFalse();
        assertThat(hasher.matches("secret", null)).isFalse();
    }
}
