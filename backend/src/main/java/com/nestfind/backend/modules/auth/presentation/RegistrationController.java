package com.nestfind.backend.modules.auth.presentation;

import com.nestfind.backend.global.web.RequestTraceFilter;
import com.nestfind.backend.modules.auth.application.RegistrationService;
import com.nestfind.backend.modules.auth.application.RegistrationService.Registration;
import com.nestfind.backend.modules.auth.application.RegistrationService.RegistrationCommand;
import com.nestfind.backend.modules.auth.presentation.dto.RegisterRequest;
import com.nestfind.backend.modules.auth.presentation.dto.RegisterResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RegistrationController {

    private final RegistrationService registrationService;

    public RegistrationController(RegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    @Operation(summary = "Create an account pending email verification")
    @PostMapping("/auth/register")
    public ResponseEntity<RegisterResponse> register(
            @Valid @RequestBody RegisterRequest request,
            HttpServletRequest httpRequest
    ) {
        Registration registration = registrationService.register(
                new RegistrationCommand(
                        request.fullName(),
                        request.email(),
                        request.password(),
                        request.mobileNumber(),
                        request.accountType()
                ),
                RequestTraceFilter.clientIp(httpRequest)
        );
        String message = registration.otpDelivered()
                ? "Registration started. Check your email for the verification code."
                : "Registration started. Request a new verification code to continue.";
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new RegisterResponse(message, registration.userId(), registration.otpExpiresAt()));
    }
}
