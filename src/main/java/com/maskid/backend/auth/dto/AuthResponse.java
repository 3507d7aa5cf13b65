package com.maskid.backend.auth.dto;

public record AuthResponse(
        String accessToken,
        String tokenType,             // 固定 "Bearer"
        Long   expiresInSec,          // 如 2592000
        Long   serverTimeEpochSec     // 伺服器時間（可用於校時）
) {}
