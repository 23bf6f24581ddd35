package com.storefront.infrastructure.security;

import com.storefront.common.exception.AuthenticationException;
import com.storefront.infrastructure.config.StorefrontProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;

/**
 * JwtTokenProvider - Bearer 토큰 발급/검증
 *
 * - HS256 서명, sub = 사용자 ID, userId/email 클레임 포함
 * - 만료 시각(exp) 검증, 폐기 목록은 두지 않음 (stateless)
 */
@Component
public class JwtTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);

    private static final int MIN_KEY_BYTES = 32;
    private static final String CLAIM_USER_ID = "userId";
    private static final String CLAIM_EMAIL = "email";

    private final SecretKey key;
    private final Duration expiration;
    private final String issuer;
    private final Clock clock;

    @Autowired
    public JwtTokenProvider(StorefrontProperties properties) {
        this(properties, Clock.systemUTC());
    }

    JwtTokenProvider(StorefrontProperties properties, Clock clock) {
        StorefrontProperties.Jwt jwt = properties.getJwt();
        if (jwt.getSecret() == null || jwt.getSecret().isBlank()) {
            throw new IllegalStateException("storefront.jwt.secret 설정이 필요합니다");
        }
        byte[] keyBytes = jwt.getSecret().getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("storefront.jwt.secret은 최소 " + MIN_KEY_BYTES + "바이트여야 합니다");
        }
        this.key = Keys.hmacShaKeyFor(keyBytes);
        this.expiration = jwt.getExpiration();
        this.issuer = jwt.getIssuer();
        this.clock = clock;
        log.info("[JwtTokenProvider] 초기화: issuer={}, expiration={}", issuer, expiration);
    }

    /**
     * 토큰 발급
     */
    public String issue(Long userId, String email) {
        Date now = Date.from(clock.instant());
        Date expiry = Date.from(clock.instant().plus(expiration));

        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_EMAIL, email)
                .issuer(issuer)
                .issuedAt(now)
                .expiration(expiry)
                .signWith(key)
                .compact();
    }

    /**
     * 토큰 검증
     *
     * @throws AuthenticationException FORBIDDEN - 서명 불일치, 형식 오류, 만료
     */
    public AuthenticatedUser verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Long userId = Long.valueOf(claims.getSubject());
            return new AuthenticatedUser(userId, claims.get(CLAIM_EMAIL, String.class));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("[JwtTokenProvider] 토큰 검증 실패: {}", e.getMessage());
            throw AuthenticationException.invalidToken(e);
        }
    }
}
