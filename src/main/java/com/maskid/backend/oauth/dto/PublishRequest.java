package com.maskid.backend.oauth.dto;

import jakarta.validation.constraints.NotNull;

public record PublishRequest(@NotNull Boolean published) {}
