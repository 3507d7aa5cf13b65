package com.maskid.backend.alias.dto;

import jakarta.validation.constraints.NotNull;

public record AliasUpdateRequest(@NotNull Boolean enabled) {}
