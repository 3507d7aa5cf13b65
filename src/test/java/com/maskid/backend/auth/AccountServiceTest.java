package com.maskid.backend.auth;

import com.maskid.backend.auth.entity.AccountCode;
import com.maskid.backend.auth.repo.AccountCodeRepo;
import com.maskid.backend.auth.service.AccountService;
import com.maskid.backend.auth.service.TokenService;
import com.maskid.backend.common.crypto.Digests;
import com.maskid.backend.idgen.IdentifierAllocator;
import com.maskid.backend.idgen.IdentifierGenerator;
import com.maskid.backend.idgen.IdentifierKind;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.repo.UserRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;

class AccountServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private final UserRepo users = Mockito.mock(UserRepo.class);
    private final AccountCodeRepo codes = Mockito.mock(AccountCodeRepo.class);
    private final TokenService tokens = Mockito.mock(TokenService.class);
    private final JavaMailSender mail = Mockito.mock(JavaMailSender.class);
    private final IdentifierGenerator generator = Mockito.mock(IdentifierGenerator.class);
    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);

    private AccountService service;

    @BeforeEach
    void setUp() {
        PlatformTransactionManager tx = Mockito.mock(PlatformTransactionManager.class);
        Mockito.when(tx.getTransaction(any())).thenAnswer(inv -> new SimpleTransactionStatus());
        Mockito.when(generator.maxAttempts()).thenReturn(10);

        service = new AccountService(users, codes, tokens, encoder, new IdentifierAllocator(generator, tx), mail);
        // ✅ unit test 直接 new 不會套用 @Value，手動設
        setField(service, "emailEnabled", true);
        setField(service, "sender", "no-reply@maskid.io");
        setField(service, "codeTtlSeconds", 3600L);
        setField(service, "publicUrl", "http://localhost:8080");
    }

    private User activatedUser(String rawPassword) {
        User u = new User();
        u.setId(1L);
        u.setEmail("son@example.com");
        u.setName("Son");
        u.setPassword(encoder.encode(rawPassword));
        u.setActivated(true);
        Mockito.when(users.findByEmailIgnoreCase("son@example.com")).thenReturn(Optional.of(u));
        Mockito.when(users.findById(1L)).thenReturn(Optional.of(u));
        return u;
    }

    @Test
    void register_hashes_password_and_mails_activation_code_stored_as_hash() {
        Mockito.when(users.existsByEmailIgnoreCase("son@example.com")).thenReturn(false);
        Mockito.when(users.saveAndFlush(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            u.setId(1L);
            return u;
        });
        Mockito.when(generator.generate(IdentifierKind.ACTIVATION_CODE, null)).thenReturn("ACT123");

        User u = service.register(" Son@Example.com ", "Son", "correct-horse", NOW);

        assertEquals("son@example.com", u.getEmail());
        assertNotEquals("correct-horse", u.getPassword());
        assertTrue(encoder.matches("correct-horse", u.getPassword()));
        assertFalse(u.isActivated());
        Mockito.verify(codes).saveAndFlush(Mockito.argThat(c ->
                c.getCodeHash().equals(Digests.sha256Hex("ACT123"))
                        && c.getPurpose() == AccountCode.Purpose.ACTIVATION
                        && c.getExpiresAt().equals(NOW.plusSeconds(3600))));
        Mockito.verify(mail).send(Mockito.argThat((SimpleMailMessage m) -> m.getText().contains("ACT123")));
    }

    @Test
    void register_rejects_existing_email() {
        Mockito.when(users.existsByEmailIgnoreCase("son@example.com")).thenReturn(true);

        var ex = assertThrows(IllegalArgumentException.class,
                () -> service.register("son@example.com", "Son", "correct-horse", NOW));
        assertEquals("EMAIL_ALREADY_USED", ex.getMessage());
    }

    @Test
    void login_with_wrong_password_is_invalid_credentials() {
        activatedUser("correct-horse");

        var ex = assertThrows(IllegalArgumentException.class,
                () -> service.login("son@example.com", "wrong", "127.0.0.1", "ua", NOW));
        assertEquals("INVALID_CREDENTIALS", ex.getMessage());
        Mockito.verifyNoInteractions(tokens);
    }

    @Test
    void login_issues_session_token() {
        activatedUser("correct-horse");
        Mockito.when(tokens.issue(1L, "127.0.0.1", "ua", NOW))
                .thenReturn(new TokenService.IssuedSession("abc", 2592000L));

        var r = service.login("SON@example.com", "correct-horse", "127.0.0.1", "ua", NOW);

        assertEquals("abc", r.accessToken());
        assertEquals("Bearer", r.tokenType());
        assertEquals(2592000L, r.expiresInSec());
    }

    @Test
    void reset_password_consumes_code_once_and_revokes_sessions() {
        User u = activatedUser("old-password");
        AccountCode ac = new AccountCode();
        ac.setId(9L);
        ac.setUserId(1L);
        ac.setPurpose(AccountCode.Purpose.RESET_PASSWORD);
        Mockito.when(codes.findByCodeHashAndPurpose(Digests.sha256Hex("RESET1"), AccountCode.Purpose.RESET_PASSWORD))
                .thenReturn(Optional.of(ac));
        Mockito.when(codes.consume(9L, NOW)).thenReturn(1, 0);

        service.resetPassword("RESET1", "new-password", NOW);

        assertTrue(encoder.matches("new-password", u.getPassword()));
        Mockito.verify(tokens).revokeAll(1L);

        var ex = assertThrows(IllegalArgumentException.class, () -> service.resetPassword("RESET1", "again-password", NOW));
        assertEquals("CODE_EXPIRED_OR_USED", ex.getMessage());
    }

    @Test
    void unknown_code_is_rejected() {
        Mockito.when(codes.findByCodeHashAndPurpose(anyString(), eq(AccountCode.Purpose.ACTIVATION)))
                .thenReturn(Optional.empty());

        var ex = assertThrows(IllegalArgumentException.class, () -> service.activate("NOPE", NOW));
        assertEquals("INVALID_CODE", ex.getMessage());
    }

    @Test
    void password_reset_for_unknown_email_sends_nothing() {
        Mockito.when(users.findByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());

        service.requestPasswordReset("ghost@example.com", NOW);

        Mockito.verifyNoInteractions(mail, generator);
    }

    // ===== helper =====
    private static void setField(Object target, String fieldName, Object value) {
        try {
            Field f = target.getClass().getDeclaredField(fieldName);
            f.setAccessible(true);
            f.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException("Failed to set field: " + fieldName, e);
        }
    }
}
