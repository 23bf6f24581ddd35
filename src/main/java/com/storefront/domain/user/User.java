package com.storefront.domain.user;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * User 도메인 엔티티
 *
 * 책임:
 * - 로그인 자격 증명(이메일, 비밀번호 해시) 보관
 *
 * 핵심 비즈니스 규칙:
 * - 이메일은 필수이며 유일함 (DB unique 제약)
 * - 비밀번호는 해시로만 저장
 */
@Entity
@Table(name = "users")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long userId;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "is_admin", nullable = false)
    private boolean admin;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 사용자 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 이메일과 비밀번호 해시는 필수
     * - 신규 사용자는 일반 사용자(admin=false)로 시작
     */
    public static User createUser(String email, String passwordHash) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일은 필수입니다");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("비밀번호 해시는 필수입니다");
        }

        return User.builder()
                .email(email)
                .passwordHash(passwordHash)
                .admin(false)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
