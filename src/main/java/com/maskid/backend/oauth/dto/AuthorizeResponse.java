package com.maskid.backend.oauth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** 前端拿 redirectTo 直接導回 client */
public record AuthorizeResponse(
        @JsonProperty("redirect_to") String redirectTo,
        @JsonProperty("code") String code,
        @JsonProperty("state") String state,
        @JsonProperty("scope") String scope,
        @JsonProperty("expires_at") Instant expiresAt
) {}
