package com.nestfind.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "email is required") @Size(max = 255) String email,
        @NotBlank(message = "password is required") @Size(max = 128) String password,
        String portal
) {
}
