package com.maskid.backend.oauth.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/** access token；scope / redirect_uri 跟原本的 authorization code 相同 */
@Getter
@Setter
@ToString
@Entity
@Table(
        name = "oauth_tokens",
        uniqueConstraints = @UniqueConstraint(name = "ux_oauth_tokens_access_token", columnNames = {"access_token"}),
        indexes = @Index(name = "idx_oauth_tokens_client_user", columnList = "client_id,user_id")
)
public class OauthToken {

    public enum State { ACTIVE, EXPIRED, REVOKED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ToString.Exclude
    @Column(name = "access_token", nullable = false, length = 128, updatable = false)
    private String accessToken;

    @Column(name = "client_id", nullable = false, updatable = false)
    private Long clientId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "scope", length = 128)
    private String scope;

    @Column(name = "redirect_uri", length = 1024)
    private String redirectUri;

    @Column(name = "authorization_code_id")
    private Long authorizationCodeId;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static OauthToken fromCode(AuthorizationCode code, String accessToken, Instant expiresAt) {
        OauthToken t = new OauthToken();
        t.setAccessToken(accessToken);
        t.setClientId(code.getClientId());
        t.setUserId(code.getUserId());
        t.setScope(code.getScope());
        t.setRedirectUri(code.getRedirectUri());
        t.setAuthorizationCodeId(code.getId());
        t.setExpiresAt(expiresAt);
        return t;
    }

    /** EXPIRED / REVOKED 都是終點 */
    public State state(Instant now) {
        if (revokedAt != null) return State.REVOKED;
        if (!expiresAt.isAfter(now)) return State.EXPIRED;
        return State.ACTIVE;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
