package com.maskid.backend.oauth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** RFC 6749 §5.1，另外帶上第一次的 user info 讓 client 少打一次 user_info */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("scope") String scope,
        @JsonProperty("user") Map<String, Object> user
) {}
