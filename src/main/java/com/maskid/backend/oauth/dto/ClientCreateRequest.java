package com.maskid.backend.oauth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ClientCreateRequest(
        @NotBlank @Size(max = 128) String name,
        @Size(max = 1024) String homeUrl
) {}
