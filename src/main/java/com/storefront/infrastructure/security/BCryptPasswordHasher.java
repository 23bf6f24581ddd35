package com.storefront.infrastructure.security;

import com.storefront.domain.user.PasswordHasher;
import com.storefront.infrastructure.config.StorefrontProperties;
import org.mindrot.jbcrypt.BCrypt;
import org.springframework.stereotype.Component;

/**
 * jBCrypt 기반 PasswordHasher 구현
 */
@Component
public class BCryptPasswordHasher implements PasswordHasher {

    private final int cost;

    public BCryptPasswordHasher(StorefrontProperties properties) {
        this.cost = properties.getSecurity().getBcryptCost();
    }

    @Override
    public String hash(String plainPassword) {
        return BCrypt.hashpw(plainPassword, BCrypt.gensalt(cost));
    }

    @Override
    public boolean matches(String plainPassword, String passwordHash) {
        if (passwordHash == null || !passwordHash.startsWith("$2")) {
            return false;
        }
        return BCrypt.checkpw(plainPassword, passwordHash);
    }
}
