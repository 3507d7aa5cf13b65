package com.maskid.backend.alias.dto;

import com.maskid.backend.alias.entity.Alias;

import java.time.Instant;

public record AliasResponse(
        Long id,
        String email,
        boolean enabled,
        Instant createdAt
) {
    public static AliasResponse from(Alias a) {
        return new AliasResponse(a.getId(), a.getEmail(), a.isEnabled(), a.getCreatedAt());
    }
}
