package com.maskid.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/** 啟用帳號 / 重設密碼的一次性 code；只存 sha256 */
@Data
@Entity
@Table(
        name = "account_codes",
        uniqueConstraints = @UniqueConstraint(name = "ux_account_codes_code_hash", columnNames = {"code_hash"}),
        indexes = @Index(name = "idx_account_codes_user_purpose", columnList = "user_id,purpose")
)
public class AccountCode {

    public enum Purpose { ACTIVATION, RESET_PASSWORD }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "code_hash", length = 64, nullable = false, updatable = false)
    private String codeHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Purpose purpose;

    @Column(nullable = false) private Instant expiresAt;
    private Instant consumedAt;
    @Column(nullable = false) private Instant createdAt;
}
