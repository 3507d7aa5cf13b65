package com.maskid.backend.auth.controller;

import com.maskid.backend.auth.dto.AuthResponse;
import com.maskid.backend.auth.dto.CodeRequest;
import com.maskid.backend.auth.dto.EmailRequest;
import com.maskid.backend.auth.dto.LoginRequest;
import com.maskid.backend.auth.dto.RegisterRequest;
import com.maskid.backend.auth.dto.ResetPasswordRequest;
import com.maskid.backend.auth.service.AccountService;
import com.maskid.backend.users.entity.User;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AccountService accounts;

    public AuthController(AccountService accounts) {
        this.accounts = accounts;
    }

    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(@Valid @RequestBody RegisterRequest req) {
        User u = accounts.register(req.email(), req.name(), req.password(), Instant.now());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("id", u.getId(), "email", u.getEmail(), "activated", u.isActivated()));
    }

    @PostMapping("/activate")
    public ResponseEntity<Map<String, Object>> activate(@Valid @RequestBody CodeRequest req) {
        User u = accounts.activate(req.code(), Instant.now());
        return ResponseEntity.ok(Map.of("id", u.getId(), "activated", true));
    }

    /** 信件內的連結 */
    @GetMapping("/activate")
    public ResponseEntity<Map<String, Object>> activateLink(@RequestParam("code") String code) {
        User u = accounts.activate(code, Instant.now());
        return ResponseEntity.ok(Map.of("id", u.getId(), "activated", true));
    }

    @PostMapping("/activation/resend")
    public ResponseEntity<Void> resendActivation(@Valid @RequestBody EmailRequest req) {
        accounts.resendActivation(req.email(), Instant.now());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest req, HttpServletRequest http) {
        String ua = Optional.ofNullable(http.getHeader("User-Agent")).orElse("");
        return ResponseEntity.ok(accounts.login(req.email(), req.password(), clientIp(http), ua, Instant.now()));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth) {
        if (auth != null && auth.startsWith("Bearer ")) {
            accounts.logout(auth.substring(7).trim());
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/password/forgot")
    public ResponseEntity<Void> forgotPassword(@Valid @RequestBody EmailRequest req) {
        accounts.requestPasswordReset(req.email(), Instant.now());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/password/reset")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody ResetPasswordRequest req) {
        accounts.resetPassword(req.code(), req.password(), Instant.now());
        return ResponseEntity.noContent().build();
    }

    private static String clientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            int comma = xff.indexOf(',');
            return (comma >= 0 ? xff.substring(0, comma) : xff).trim();
        }
        return request.getRemoteAddr();
    }
}
