package com.maskid.backend.users.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PromoCodeRequest(@NotBlank @Size(max = 64) String code) {}
