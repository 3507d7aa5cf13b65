package com.maskid.backend.oauth.dto;

import java.time.Instant;
import java.util.List;

/** 開發者後台的 client 詳細資料；secret 只在建立時回傳一次（見 ClientCreatedResponse） */
public record ClientResponse(
        Long id,
        String clientId,
        String name,
        String homeUrl,
        boolean published,
        long nbUser,
        String iconUrl,
        List<String> redirectUris,
        Instant createdAt
) {}
