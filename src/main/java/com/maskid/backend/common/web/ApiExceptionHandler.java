package com.maskid.backend.common.web;

import com.maskid.backend.alias.web.QuotaExceededException;
import com.maskid.backend.idgen.GenerationExhaustedException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 統一把常見例外轉成「可預期」的 HTTP 狀態碼與錯誤格式：
 * - 400：參數格式錯 / IllegalArgument
 * - 401 / 403：帳號密碼錯、未啟用、alias 額度用完（提示升級）
 * - 404：找不到資源（USER_NOT_FOUND / ALIAS_NOT_FOUND / CLIENT_NOT_FOUND）
 * - 409：唯一值已被使用（EMAIL_ALREADY_USED）
 * - 500：識別碼產生重試用盡、其他未預期錯誤
 * OAuth endpoint 另有 OAuthExceptionAdvice（RFC 6749 的 error 格式），優先於這裡。
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArg(IllegalArgumentException ex, HttpServletRequest req) {
        String code = norm(ex.getMessage(), "BAD_REQUEST");
        HttpStatus status = switch (code) {
            case "USER_NOT_FOUND", "ALIAS_NOT_FOUND", "CLIENT_NOT_FOUND", "FILE_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "EMAIL_ALREADY_USED" -> HttpStatus.CONFLICT;
            case "INVALID_CREDENTIALS" -> HttpStatus.UNAUTHORIZED;
            case "ACCOUNT_NOT_ACTIVATED", "NOT_CLIENT_OWNER" -> HttpStatus.FORBIDDEN;
            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(err(code, ex.getMessage(), req));
    }

    /** 額度用完：recoverable，前端拿 clientAction 顯示升級提示 */
    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<Map<String, Object>> handleQuota(QuotaExceededException ex, HttpServletRequest req) {
        Map<String, Object> body = err("QUOTA_EXCEEDED", ex.getMessage(), req);
        body.put("clientAction", ex.clientAction());
        body.put("limit", ex.limit());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
    }

    /** 識別碼空間重試用盡：給維運看的 fatal，不自動重試 */
    @ExceptionHandler(GenerationExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleExhausted(GenerationExhaustedException ex, HttpServletRequest req) {
        log.error("identifier generation exhausted: kind={}, attempts={}", ex.kind(), ex.attempts());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("GENERATION_EXHAUSTED", null, req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", ex.getMessage(), req));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNoSuch(NoSuchElementException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(err("NOT_FOUND", ex.getMessage(), req));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatusCode status = ex.getStatusCode();
        String code = (ex.getReason() == null) ? "ERROR" : ex.getReason();
        return ResponseEntity.status(status).body(err(code, ex.getReason(), req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled exception: {}", ex.toString(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", "Unexpected error", req));
    }

    private static String norm(String s, String fallback) {
        return (s == null || s.isBlank()) ? fallback : s.trim();
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        m.put("requestId", RequestIdFilter.getOrCreate(req));
        return m;
    }
}
