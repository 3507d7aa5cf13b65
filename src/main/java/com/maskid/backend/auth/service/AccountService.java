package com.maskid.backend.auth.service;

import com.maskid.backend.auth.dto.AuthResponse;
import com.maskid.backend.auth.entity.AccountCode;
import com.maskid.backend.auth.repo.AccountCodeRepo;
import com.maskid.backend.common.crypto.Digests;
import com.maskid.backend.idgen.IdentifierAllocator;
import com.maskid.backend.idgen.IdentifierKind;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.UserRepo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Locale;

/**
 * 註冊 → 啟用 → 登入 / 登出，以及忘記密碼。
 * 啟用碼與重設碼都是一次性、有 TTL，DB 只存 sha256。
 */
@Slf4j
@Service
public class AccountService {

    private final UserRepo users;
    private final AccountCodeRepo codes;
    private final TokenService tokens;
    private final PasswordEncoder passwordEncoder;
    private final IdentifierAllocator allocator;
    private final JavaMailSender mail;

    public AccountService(UserRepo users,
                          AccountCodeRepo codes,
                          TokenService tokens,
                          PasswordEncoder passwordEncoder,
                          IdentifierAllocator allocator,
                          JavaMailSender mail) {
        this.users = users;
        this.codes = codes;
        this.tokens = tokens;
        this.passwordEncoder = passwordEncoder;
        this.allocator = allocator;
        this.mail = mail;
    }

    @Value("${app.email.enabled:true}") boolean emailEnabled;
    @Value("${app.email.sender:no-reply@maskid.io}") String sender;
    @Value("${app.account.code-ttl-sec:3600}") long codeTtlSeconds;
    @Value("${app.public-url:http://localhost:8080}") String publicUrl;

    public User register(String email, String name, String rawPassword, Instant now) {
        String normalized = normalizeEmail(email);
        if (users.existsByEmailIgnoreCase(normalized)) throw new IllegalArgumentException("EMAIL_ALREADY_USED");

        User u = new User();
        u.setEmail(normalized);
        u.setName(name.trim());
        u.setPassword(passwordEncoder.encode(rawPassword));
        try {
            u = users.saveAndFlush(u);
        } catch (DataIntegrityViolationException e) {
            // 併發：同一 email 同時註冊
            throw new IllegalArgumentException("EMAIL_ALREADY_USED");
        }
        log.info("user {} registered", u.getId());

        String code = issueCode(u.getId(), AccountCode.Purpose.ACTIVATION, now);
        send(u.getEmail(), "Activate your MaskID account",
                "Your activation code is: " + code
                        + "\nOr open " + publicUrl + "/auth/activate?code=" + code
                        + "\nIt will expire in " + (codeTtlSeconds / 60) + " minutes.");
        return u;
    }

    @Transactional
    public User activate(String code, Instant now) {
        AccountCode ac = consumeCode(code, AccountCode.Purpose.ACTIVATION, now);
        User u = users.findById(ac.getUserId()).orElseThrow(() -> new IllegalArgumentException("USER_NOT_FOUND"));
        u.setActivated(true);
        log.info("user {} activated", u.getId());
        return users.save(u);
    }

    /** 重寄啟用碼；已啟用或不存在的 email 不透露 */
    public void resendActivation(String email, Instant now) {
        users.findByEmailIgnoreCase(normalizeEmail(email))
                .filter(u -> !u.isActivated())
                .ifPresent(u -> {
                    String code = issueCode(u.getId(), AccountCode.Purpose.ACTIVATION, now);
                    send(u.getEmail(), "Activate your MaskID account", "Your activation code is: " + code);
                });
    }

    public AuthResponse login(String email, String rawPassword, String ip, String ua, Instant now) {
        User u = users.findByEmailIgnoreCase(normalizeEmail(email))
                .orElseThrow(() -> new IllegalArgumentException("INVALID_CREDENTIALS"));
        if (!passwordEncoder.matches(rawPassword, u.getPassword())) {
            log.info("login failed for user {}", u.getId());
            throw new IllegalArgumentException("INVALID_CREDENTIALS");
        }
        if (!u.isActivated()) throw new IllegalArgumentException("ACCOUNT_NOT_ACTIVATED");

        var session = tokens.issue(u.getId(), ip, ua, now);
        return new AuthResponse(session.token(), "Bearer", session.expiresInSec(), now.getEpochSecond());
    }

    public void logout(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) return;
        tokens.revoke(sessionToken);
    }

    /** 不論 email 是否存在都回成功，避免被拿來探測帳號 */
    public void requestPasswordReset(String email, Instant now) {
        users.findByEmailIgnoreCase(normalizeEmail(email)).ifPresentOrElse(u -> {
            String code = issueCode(u.getId(), AccountCode.Purpose.RESET_PASSWORD, now);
            send(u.getEmail(), "Reset your MaskID password",
                    "Your password reset code is: " + code
                            + "\nIt will expire in " + (codeTtlSeconds / 60) + " minutes.");
        }, () -> log.info("password reset requested for unknown email"));
    }

    @Transactional
    public void resetPassword(String code, String newRawPassword, Instant now) {
        AccountCode ac = consumeCode(code, AccountCode.Purpose.RESET_PASSWORD, now);
        User u = users.findById(ac.getUserId()).orElseThrow(() -> new IllegalArgumentException("USER_NOT_FOUND"));
        u.setPassword(passwordEncoder.encode(newRawPassword));
        users.save(u);
        int revoked = tokens.revokeAll(u.getId());
        log.info("user {} reset password, {} sessions revoked", u.getId(), revoked);
    }

    /**
     * 產生新 code（舊的同用途 code 一併作廢），回傳明碼；明碼只出現在信件內容。
     */
    public String issueCode(Long userId, AccountCode.Purpose purpose, Instant now) {
        IdentifierKind kind = (purpose == AccountCode.Purpose.ACTIVATION)
                ? IdentifierKind.ACTIVATION_CODE
                : IdentifierKind.RESET_PASSWORD_CODE;
        return allocator.allocate(kind, code -> {
            codes.consumeAllActive(userId, purpose, now);
            var ent = new AccountCode();
            ent.setUserId(userId);
            ent.setCodeHash(Digests.sha256Hex(code));
            ent.setPurpose(purpose);
            ent.setCreatedAt(now);
            ent.setExpiresAt(now.plusSeconds(codeTtlSeconds));
            codes.saveAndFlush(ent);
            return code;
        });
    }

    private AccountCode consumeCode(String code, AccountCode.Purpose purpose, Instant now) {
        if (code == null || code.isBlank()) throw new IllegalArgumentException("CODE_REQUIRED");
        AccountCode ac = codes.findByCodeHashAndPurpose(Digests.sha256Hex(code.trim()), purpose)
                .orElseThrow(() -> new IllegalArgumentException("INVALID_CODE"));
        // 條件式 update：用過或過期都拿到 0
        if (codes.consume(ac.getId(), now) != 1) throw new IllegalArgumentException("CODE_EXPIRED_OR_USED");
        return ac;
    }

    private void send(String to, String subject, String text) {
        if (!emailEnabled) {
            log.info("email disabled, skip sending '{}'", subject);
            return;
        }
        var msg = new SimpleMailMessage();
        msg.setFrom(sender);
        msg.setTo(to);
        msg.setSubject(subject);
        msg.setText(text);
        try {
            mail.send(msg);
        } catch (MailException e) {
            // 帳號已建立，code 可以重寄
            log.error("send '{}' failed: {}", subject, e.toString());
        }
    }

    private static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) throw new IllegalArgumentException("EMAIL_REQUIRED");
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
