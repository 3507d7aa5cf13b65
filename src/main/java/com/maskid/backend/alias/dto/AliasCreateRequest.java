package com.maskid.backend.alias.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** prefix 可省略：省略時用隨機單字組 */
public record AliasCreateRequest(
        @Size(max = 30)
        @Pattern(regexp = "^[A-Za-z0-9_.-]*$", message = "only letters, digits, '_', '.', '-'")
        String prefix
) {}
