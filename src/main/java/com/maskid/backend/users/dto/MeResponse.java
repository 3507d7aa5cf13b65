package com.maskid.backend.users.dto;

import java.time.Instant;

public record MeResponse(
        Long id,
        String email,
        String name,
        String plan,
        Instant planExpiration,
        boolean premium,
        boolean shouldUpgrade,
        boolean canCreateAlias,
        long aliasCount,
        String profilePictureUrl,
        Instant planCurrentPeriodEnd,
        boolean developer
) {}
