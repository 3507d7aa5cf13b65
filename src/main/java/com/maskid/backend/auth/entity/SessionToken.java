package com.maskid.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.Instant;

/** 登入後發給使用者的 opaque bearer token（不是 OAuth access token） */
@Data
@Entity
@Table(
        name = "session_tokens",
        uniqueConstraints = @UniqueConstraint(name = "ux_session_tokens_token", columnNames = {"token"}),
        indexes = @Index(name = "idx_session_tokens_user", columnList = "user_id")
)
public class SessionToken {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @Column(nullable = false, length = 64, updatable = false)
    private String token;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(nullable = false) private Instant expiresAt;
    @Column(nullable = false) private Instant createdAt = Instant.now();
    @Column(nullable = false) private boolean revoked = false;
    private String clientIp;
    private String userAgent;

    public boolean isActive(Instant now) {
        return !revoked && expiresAt != null && expiresAt.isAfter(now);
    }
}
