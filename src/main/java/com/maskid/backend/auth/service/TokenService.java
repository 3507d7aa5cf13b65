package com.maskid.backend.auth.service;

import com.maskid.backend.auth.entity.SessionToken;
import com.maskid.backend.auth.repo.SessionTokenRepo;
import com.maskid.backend.idgen.IdentifierAllocator;
import com.maskid.backend.idgen.IdentifierKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
public class TokenService {

    private final SessionTokenRepo repo;
    private final IdentifierAllocator allocator;
    private final long sessionTtlSeconds;

    public TokenService(
            SessionTokenRepo repo,
            IdentifierAllocator allocator,
            @Value("${app.auth.session-ttl-sec:2592000}") long sessionTtlSeconds // 30 天
    ) {
        this.repo = repo;
        this.allocator = allocator;
        this.sessionTtlSeconds = sessionTtlSeconds;
    }

    public IssuedSession issue(Long userId, String ip, String ua, Instant now) {
        SessionToken saved = allocator.allocate(IdentifierKind.SESSION_TOKEN, value -> {
            var t = new SessionToken();
            t.setToken(value);
            t.setUserId(userId);
            t.setCreatedAt(now);
            t.setExpiresAt(now.plusSeconds(sessionTtlSeconds));
            t.setClientIp(ip);
            t.setUserAgent(ua);
            return repo.saveAndFlush(t);
        });
        return new IssuedSession(saved.getToken(), sessionTtlSeconds);
    }

    /** 有效才回 userId；不存在 / 過期 / 已撤銷一律 empty */
    @Transactional(readOnly = true)
    public Optional<Long> validate(String token, Instant now) {
        if (token == null || token.isBlank()) return Optional.empty();
        return repo.findByToken(token)
                .filter(t -> t.isActive(now))
                .map(SessionToken::getUserId);
    }

    @Transactional
    public void revoke(String token) {
        repo.findByToken(token).ifPresent(t -> { t.setRevoked(true); repo.save(t); });
    }

    @Transactional
    public int revokeAll(Long userId) {
        return repo.revokeAllByUserId(userId);
    }

    public record IssuedSession(String token, long expiresInSec) {}
}
