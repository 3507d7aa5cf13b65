package com.maskid.backend.alias.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/** 產生的 email alias；email 全域唯一，一輩子只屬於一個 user */
@Getter
@Setter
@ToString
@Entity
@Table(
        name = "aliases",
        uniqueConstraints = @UniqueConstraint(name = "ux_aliases_email", columnNames = {"email"}),
        indexes = @Index(name = "idx_aliases_user", columnList = "user_id")
)
public class Alias {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "email", nullable = false, length = 128, updatable = false)
    private String email;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public static Alias of(Long userId, String email) {
        Alias a = new Alias();
        a.setUserId(userId);
        a.setEmail(email);
        return a;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
