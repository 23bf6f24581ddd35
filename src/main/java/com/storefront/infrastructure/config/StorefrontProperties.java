package com.storefront.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * storefront.* 설정 바인딩
 *
 * application.yml 예시:
 * storefront:
 *   jwt:
 *     secret: ${JWT_SECRET}
 *     expiration: 1h
 *   security:
 *     bcrypt-cost: 10
 */
@Data
@ConfigurationProperties(prefix = "storefront")
public class StorefrontProperties {

    private Jwt jwt = new Jwt();
    private Security security = new Security();

    @Data
    public static class Jwt {
        /** HS256 서명 키 (32바이트 이상) */
        private String secret;
        /** 토큰 유효 시간 */
        private Duration expiration = Duration.ofHours(1);
        private String issuer = "storefront-api";
    }

    @Data
    public static class Security {
        /** BCrypt work factor */
        private int bcryptCost = 10;
    }
}
