package com.maskid.backend.auth.dto;

import jakarta.validation.constraints.NotBlank;

public record CodeRequest(@NotBlank String code) {}
