package com.maskid.backend.oauth.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/** 一次性 authorization code；consumedAt 只會由 AuthorizationCodeRepo#consume 寫入 */
@Getter
@Setter
@ToString
@Entity
@Table(
        name = "authorization_codes",
        uniqueConstraints = @UniqueConstraint(name = "ux_authorization_codes_code", columnNames = {"code"})
)
public class AuthorizationCode {

    public enum State { ISSUED, CONSUMED, EXPIRED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @Column(name = "code", nullable = false, length = 128, updatable = false)
    private String code;

    @Column(name = "client_id", nullable = false, updatable = false)
    private Long clientId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "scope", length = 128)
    private String scope;

    @Column(name = "redirect_uri", length = 1024)
    private String redirectUri;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "consumed_at")
    private Instant consumedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /** CONSUMED 優先：用過的 code 不管有沒有過期都是 replay */
    public State state(Instant now) {
        if (consumedAt != null) return State.CONSUMED;
        if (!expiresAt.isAfter(now)) return State.EXPIRED;
        return State.ISSUED;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
