package com.maskid.backend.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResetPasswordRequest(
        @NotBlank String code,
        @NotBlank @Size(min = 8, max = 128) String password
) {}
