package com.nestfind.backend.modules.auth.application;

/**
 * Outbound delivery of a verification code. Called after the code's row has committed, never
 * while a row lock is held.
 */
public interface OtpMailSender {

    void sendOtp(String email, String code);
}
