package com.maskid.backend.oauth.dto;

import com.maskid.backend.oauth.entity.Client;

public record ClientCreatedResponse(
        Long id,
        String clientId,
        String clientSecret,
        String name,
        String homeUrl
) {
    public static ClientCreatedResponse from(Client c) {
        return new ClientCreatedResponse(c.getId(), c.getOauthClientId(), c.getOauthClientSecret(), c.getName(), c.getHomeUrl());
    }
}
