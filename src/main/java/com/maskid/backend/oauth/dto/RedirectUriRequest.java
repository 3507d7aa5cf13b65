package com.maskid.backend.oauth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RedirectUriRequest(@NotBlank @Size(max = 512) String uri) {}
