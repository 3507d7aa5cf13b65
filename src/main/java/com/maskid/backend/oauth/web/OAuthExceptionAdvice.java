package com.maskid.backend.oauth.web;

import com.maskid.backend.common.web.RequestIdFilter;
import com.maskid.backend.oauth.controller.OAuthController;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(assignableTypes = OAuthController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class OAuthExceptionAdvice {

    @ExceptionHandler(OAuthException.class)
    public ResponseEntity<Map<String, Object>> handleOAuth(OAuthException e, HttpServletRequest req) {
        log.info("oauth error {} on {}: {}", e.error(), req.getRequestURI(), e.getMessage());
        var res = ResponseEntity.status(e.status())
                .header(HttpHeaders.CACHE_CONTROL, "no-store");
        if (e instanceof InvalidTokenException) {
            res.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        } else if (e instanceof UnauthorizedClientException) {
            res.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"oauth\"");
        }
        return res.body(body(e.error(), e.getMessage(), req));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParam(MissingServletRequestParameterException e,
                                                                  HttpServletRequest req) {
        return ResponseEntity.badRequest()
                .body(body("invalid_request", e.getParameterName() + " is required", req));
    }

    private static Map<String, Object> body(String error, String description, HttpServletRequest req) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", error);
        if (description != null && !description.isBlank()) m.put("error_description", description);
        m.put("requestId", RequestIdFilter.getOrCreate(req));
        return m;
    }
}
