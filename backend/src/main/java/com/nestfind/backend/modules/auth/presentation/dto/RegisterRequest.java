package com.nestfind.backend.modules.auth.presentation.dto;

import com.nestfind.backend.modules.auth.domain.AccountType;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "fullName is required") @Size(max = 120) String fullName,
        @NotBlank(message = "email is required") @Email @Size(max = 255) String email,
        @NotBlank(message = "password is required") @Size(max = 128) String password,
        @Size(max = 32) String mobileNumber,
        AccountType accountType
) {
}
