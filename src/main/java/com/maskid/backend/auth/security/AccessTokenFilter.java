package com.maskid.backend.auth.security;

import com.maskid.backend.auth.service.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;

@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    private final TokenService tokens;

    public AccessTokenFilter(TokenService tokens) {
        this.tokens = tokens;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        // 放行登入、健康檢查，以及自己驗 client / OAuth access token 的 endpoint
        return p.startsWith("/auth")
                || p.startsWith("/actuator")
                || p.startsWith("/static")
                || p.equals("/oauth/token")
                || p.equals("/oauth/user_info")
                || p.equals("/oauth/revoke");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith("Bearer ")) {
            chain.doFilter(req, res); // 交給後面處理（匿名或由 EntryPoint 回 401）
            return;
        }

        String raw = auth.substring(7).trim();
        Optional<Long> uid = tokens.validate(raw, Instant.now());
        if (uid.isEmpty()) {
            unauthorized(res);
            return;
        }

        // principal 只放 userId，不放 JPA entity
        var authentication = new UsernamePasswordAuthenticationToken(
                uid.get(),
                null,
                Collections.emptyList()
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        chain.doFilter(req, res);
    }

    private static void unauthorized(HttpServletResponse res) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType("application/json");
        res.getWriter().write("{\"code\":\"UNAUTHORIZED\",\"message\":\"Invalid or expired session token\"}");
    }
}
