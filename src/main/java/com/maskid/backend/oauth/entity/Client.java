package com.maskid.backend.oauth.entity;

import com.maskid.backend.oauth.model.Scope;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/** OAuth relying party */
@Getter
@Setter
@ToString
@Entity
@Table(
        name = "clients",
        uniqueConstraints = @UniqueConstraint(name = "ux_clients_oauth_client_id", columnNames = {"oauth_client_id"}),
        indexes = @Index(name = "idx_clients_user", columnList = "user_id")
)
public class Client {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "oauth_client_id", nullable = false, length = 128, updatable = false)
    private String oauthClientId;

    @ToString.Exclude
    @Column(name = "oauth_client_secret", nullable = false, length = 128)
    private String oauthClientSecret;

    @Column(name = "name", nullable = false, length = 128)
    private String name;

    @Column(name = "home_url", length = 1024)
    private String homeUrl;

    @Column(name = "published", nullable = false)
    private boolean published = false;

    /** 建立這個 client 的 user */
    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "icon_id")
    private Long iconId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // TODO: 讓 client 自選要哪些 scope（需要 client_scopes 表 + 開發者後台設定）
    public Set<Scope> getScopes() {
        return EnumSet.of(Scope.NAME, Scope.EMAIL, Scope.AVATAR_URL);
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
