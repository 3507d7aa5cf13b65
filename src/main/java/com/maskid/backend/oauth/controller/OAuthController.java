package com.maskid.backend.oauth.controller;

import com.maskid.backend.auth.security.AuthContext;
import com.maskid.backend.oauth.dto.AuthorizeResponse;
import com.maskid.backend.oauth.dto.TokenResponse;
import com.maskid.backend.oauth.service.AuthorizationService;
import com.maskid.backend.oauth.web.InvalidRequestException;
import com.maskid.backend.oauth.web.InvalidTokenException;
import com.maskid.backend.oauth.web.UnauthorizedClientException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * authorization code flow：
 * <ul>
 *   <li>POST /oauth/authorize：已登入的使用者同意授權，回傳帶 code 的 redirect</li>
 *   <li>POST /oauth/token：client 用 code 換 access token（form 或 HTTP Basic 帶 client 認證）</li>
 *   <li>GET  /oauth/user_info：Bearer access token → 依 scope 投影的 user info</li>
 *   <li>POST /oauth/revoke：client 撤銷自己的 token</li>
 * </ul>
 * 錯誤格式由 OAuthExceptionAdvice 處理。
 */
@RestController
@RequestMapping("/oauth")
@RequiredArgsConstructor
public class OAuthController {

    private final AuthorizationService authorization;
    private final AuthContext auth;

    @PostMapping("/authorize")
    public AuthorizeResponse authorize(
            @RequestParam(value = "response_type", required = false, defaultValue = "code") String responseType,
            @RequestParam("client_id") String clientId,
            @RequestParam("redirect_uri") String redirectUri,
            @RequestParam(value = "scope", required = false) String scope,
            @RequestParam(value = "state", required = false) String state
    ) {
        if (!"code".equals(responseType)) {
            throw new InvalidRequestException("unsupported response_type: " + responseType);
        }
        Long uid = auth.requireUserId();
        var r = authorization.authorize(uid, clientId, redirectUri, scope, Instant.now());

        var redirect = UriComponentsBuilder.fromUriString(r.redirectUri()).queryParam("code", r.code());
        if (state != null && !state.isBlank()) redirect.queryParam("state", state);
        return new AuthorizeResponse(redirect.encode().build().toUriString(), r.code(), state, r.scope(), r.expiresAt());
    }

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<TokenResponse> token(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader,
            @RequestParam("grant_type") String grantType,
            @RequestParam(value = "code", required = false) String code,
            @RequestParam(value = "redirect_uri", required = false) String redirectUri,
            @RequestParam(value = "client_id", required = false) String formClientId,
            @RequestParam(value = "client_secret", required = false) String formClientSecret
    ) {
        String[] credentials = clientCredentials(authHeader, formClientId, formClientSecret);
        var r = authorization.exchange(grantType, code, redirectUri, credentials[0], credentials[1], Instant.now());
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .header(HttpHeaders.PRAGMA, "no-cache")
                .body(new TokenResponse(r.accessToken(), "Bearer", r.expiresIn(), r.scope(), r.user()));
    }

    @GetMapping("/user_info")
    public ResponseEntity<Map<String, Object>> userInfo(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader
    ) {
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            throw new InvalidTokenException("Bearer access token required");
        }
        var info = authorization.userInfo(authHeader.substring(7).trim(), Instant.now());
        return ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(info);
    }

    @PostMapping(value = "/revoke", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Void> revoke(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authHeader,
            @RequestParam("token") String token,
            @RequestParam(value = "client_id", required = false) String formClientId,
            @RequestParam(value = "client_secret", required = false) String formClientSecret
    ) {
        String[] credentials = clientCredentials(authHeader, formClientId, formClientSecret);
        authorization.revoke(token, credentials[0], credentials[1], Instant.now());
        return ResponseEntity.ok().build();
    }

    /** HTTP Basic 優先，其次 form；兩邊都帶時 client_id 必須一致 */
    static String[] clientCredentials(String authHeader, String formClientId, String formClientSecret) {
        if (authHeader != null && authHeader.startsWith("Basic ")) {
            String[] basic = parseBasic(authHeader.substring(6).trim());
            if (formClientId != null && !formClientId.equals(basic[0])) {
                throw new InvalidRequestException("client_id mismatch between header and body");
            }
            return basic;
        }
        return new String[]{formClientId, formClientSecret};
    }

    private static String[] parseBasic(String encoded) {
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedClientException("malformed Basic credentials");
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) throw new UnauthorizedClientException("malformed Basic credentials");
        // RFC 6749 §2.3.1：兩段各自 form-urlencoded
        return new String[]{
                URLDecoder.decode(decoded.substring(0, colon), StandardCharsets.UTF_8),
                URLDecoder.decode(decoded.substring(colon + 1), StandardCharsets.UTF_8)
        };
    }
}
