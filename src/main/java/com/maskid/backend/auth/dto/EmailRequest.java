package com.maskid.backend.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/** 重寄啟用碼 / 忘記密碼 */
public record EmailRequest(@NotBlank @Email String email) {}
