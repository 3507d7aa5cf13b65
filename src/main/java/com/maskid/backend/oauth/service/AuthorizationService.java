package com.maskid.backend.oauth.service;

import com.maskid.backend.idgen.IdentifierAllocator;
import com.maskid.backend.idgen.IdentifierKind;
import com.maskid.backend.oauth.entity.AuthorizationCode;
import com.maskid.backend.oauth.entity.Client;
import com.maskid.backend.oauth.entity.ClientUser;
import com.maskid.backend.oauth.entity.OauthToken;
import com.maskid.backend.oauth.model.Scope;
import com.maskid.backend.oauth.repo.AuthorizationCodeRepo;
import com.maskid.backend.oauth.repo.OauthTokenRepo;
import com.maskid.backend.oauth.web.ExpiredGrantException;
import com.maskid.backend.oauth.web.InvalidGrantException;
import com.maskid.backend.oauth.web.InvalidRequestException;
import com.maskid.backend.oauth.web.InvalidTokenException;
import com.maskid.backend.oauth.web.UnauthorizedClientException;
import com.maskid.backend.oauth.web.UnsupportedGrantTypeException;
import com.maskid.backend.users.entity.User;
import com.maskid.backend.users.service.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * requested → code_issued → exchanged → active → (expired | revoked)
 * <ul>
 *   <li>authorize：解析 binding 後發 authorization code（短 TTL）</li>
 *   <li>exchange：code 一次性；「標記已使用」與「發 token」在同一個 transaction</li>
 *   <li>userInfo：用 access token 重跑 ScopeProjector，不再走 consent</li>
 * </ul>
 * 到期一律在使用當下比較時間，沒有背景清理。
 */
@Slf4j
@Service
public class AuthorizationService {

    public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";

    private final ClientService clients;
    private final UserService users;
    private final ConsentBindingService consent;
    private final ScopeGrantPolicy scopePolicy;
    private final ScopeProjector projector;
    private final AuthorizationCodeRepo codes;
    private final OauthTokenRepo tokens;
    private final IdentifierAllocator allocator;
    private final long codeTtlSeconds;
    private final long tokenTtlSeconds;

    public AuthorizationService(ClientService clients,
                                UserService users,
                                ConsentBindingService consent,
                                ScopeGrantPolicy scopePolicy,
                                ScopeProjector projector,
                                AuthorizationCodeRepo codes,
                                OauthTokenRepo tokens,
                                IdentifierAllocator allocator,
                                @Value("${app.oauth.code-ttl-sec:600}") long codeTtlSeconds,     // 10 分
                                @Value("${app.oauth.token-ttl-sec:86400}") long tokenTtlSeconds) { // 1 天
        this.clients = clients;
        this.users = users;
        this.consent = consent;
        this.scopePolicy = scopePolicy;
        this.projector = projector;
        this.codes = codes;
        this.tokens = tokens;
        this.allocator = allocator;
        this.codeTtlSeconds = codeTtlSeconds;
        this.tokenTtlSeconds = tokenTtlSeconds;
    }

    public record AuthorizeResult(String code, String redirectUri, String scope, Long bindingId, Instant expiresAt) {}

    public record TokenResult(String accessToken, long expiresIn, String scope, Map<String, Object> user) {}

    public AuthorizeResult authorize(Long userId, String oauthClientId, String redirectUri,
                                     String requestedScope, Instant now) {
        Client client = clients.requireByOauthClientId(oauthClientId);
        if (!clients.isRedirectUriAllowed(client, redirectUri)) {
            throw new InvalidRequestException("redirect_uri not registered for this client");
        }
        Set<Scope> requested;
        try {
            requested = Scope.parse(requestedScope);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("invalid scope: " + requestedScope);
        }

        User user = users.require(userId);
        Set<Scope> granted = scopePolicy.grant(client, user, requested);
        ClientUser binding = consent.getOrCreateBinding(client, user, now);

        String scope = Scope.format(granted);
        String normalizedRedirect = redirectUri.trim();
        AuthorizationCode ac = allocator.allocate(IdentifierKind.AUTH_CODE, value -> {
            AuthorizationCode c = new AuthorizationCode();
            c.setCode(value);
            c.setClientId(client.getId());
            c.setUserId(user.getId());
            c.setScope(scope);
            c.setRedirectUri(normalizedRedirect);
            c.setExpiresAt(now.plusSeconds(codeTtlSeconds));
            return codes.saveAndFlush(c);
        });
        log.info("code issued: client={}, user={}, binding={}, scope=[{}]",
                client.getOauthClientId(), user.getId(), binding.getId(), scope);
        return new AuthorizeResult(ac.getCode(), normalizedRedirect, scope, binding.getId(), ac.getExpiresAt());
    }

    public TokenResult exchange(String grantType, String code, String redirectUri,
                                String oauthClientId, String clientSecret, Instant now) {
        if (!GRANT_AUTHORIZATION_CODE.equals(grantType)) {
            throw new UnsupportedGrantTypeException(grantType);
        }
        if (code == null || code.isBlank()) throw new InvalidRequestException("code is required");

        Client client = clients.authenticate(oauthClientId, clientSecret);

        AuthorizationCode ac = codes.findByCode(code)
                .orElseThrow(() -> new InvalidGrantException("invalid authorization code"));
        if (!ac.getClientId().equals(client.getId())) {
            log.warn("client {} presented a code issued to client pk {}", client.getOauthClientId(), ac.getClientId());
            throw new InvalidGrantException("invalid authorization code");
        }
        switch (ac.state(now)) {
            case CONSUMED -> {
                log.warn("replay of consumed code {} by client {}", ac.getId(), client.getOauthClientId());
                throw new InvalidGrantException("authorization code already used");
            }
            case EXPIRED -> throw new ExpiredGrantException("authorization code expired");
            case ISSUED -> { }
        }
        if (!Objects.equals(ac.getRedirectUri(), redirectUri == null ? null : redirectUri.trim())) {
            throw new InvalidGrantException("redirect_uri mismatch");
        }

        OauthToken token;
        try {
            token = allocator.allocate(IdentifierKind.ACCESS_TOKEN, value -> {
                // 條件式 update 搶 code：並行的第二個 exchange 這裡一定拿到 0
                if (codes.consume(ac.getId(), now) != 1) {
                    throw new InvalidGrantException("authorization code already used");
                }
                return tokens.saveAndFlush(OauthToken.fromCode(ac, value, now.plusSeconds(tokenTtlSeconds)));
            });
        } catch (ConcurrencyFailureException e) {
            // 另一個 exchange 正鎖著同一筆 code
            log.warn("concurrent exchange of code {}: {}", ac.getId(), e.toString());
            throw new InvalidGrantException("authorization code already used");
        }
        log.info("token issued: client={}, user={}, scope=[{}]", client.getOauthClientId(), ac.getUserId(), ac.getScope());

        Map<String, Object> userInfo = project(token, now);
        return new TokenResult(token.getAccessToken(), tokenTtlSeconds, token.getScope(), userInfo);
    }

    public Map<String, Object> userInfo(String accessToken, Instant now) {
        OauthToken token = requireActive(accessToken, now);
        return project(token, now);
    }

    /** client 自己撤銷自己的 token；不存在或已失效視為成功（RFC 7009） */
    @Transactional
    public void revoke(String accessToken, String oauthClientId, String clientSecret, Instant now) {
        Client client = clients.authenticate(oauthClientId, clientSecret);
        if (accessToken == null || accessToken.isBlank()) throw new InvalidRequestException("token is required");
        tokens.findByAccessToken(accessToken).ifPresent(t -> {
            if (!t.getClientId().equals(client.getId())) {
                throw new UnauthorizedClientException("token was not issued to this client");
            }
            if (tokens.revokeIfActive(t.getId(), now) == 1) {
                log.info("token {} revoked by client {}", t.getId(), client.getOauthClientId());
            }
        });
    }

    private OauthToken requireActive(String accessToken, Instant now) {
        if (accessToken == null || accessToken.isBlank()) throw new InvalidTokenException("access token required");
        OauthToken t = tokens.findByAccessToken(accessToken)
                .orElseThrow(() -> new InvalidTokenException("unknown access token"));
        return switch (t.state(now)) {
            case ACTIVE -> t;
            case EXPIRED -> throw new InvalidTokenException("access token expired");
            case REVOKED -> throw new InvalidTokenException("access token revoked");
        };
    }

    private Map<String, Object> project(OauthToken token, Instant now) {
        Client client = clients.requireById(token.getClientId());
        User user = users.require(token.getUserId());
        Set<Scope> granted = Scope.parse(token.getScope());
        // binding 在 authorize 時已建立；這裡用 getOrCreate 只為了冪等
        ClientUser binding = consent.find(client.getId(), user.getId())
                .orElseGet(() -> consent.getOrCreateBinding(client, user, now));
        return projector.project(binding, client, user, granted);
    }
}
