package com.nestfind.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.UUID;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

/**
 * Keyed one-way hashing (HMAC-SHA256 with a server-held secret) for every secret this service
 * persists: refresh tokens, OTP codes and device fingerprints.
 */
@Component
public class TokenHasher {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public TokenHasher(AuthPolicyProperties properties) {
        this.key = new SecretKeySpec(properties.tokenHashSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String hash(String value) {
        try {
            // Mac instances are not thread-safe
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(value.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC_SHA256_FAILED", e);
        }
    }

    /**
     * Binds the code to its owner so equal codes issued to different users hash differently.
     */
    public String hashOtp(UUID userId, String code) {
        return hash(userId + ":" + code);
    }

    public boolean matches(String expectedHash, String candidateHash) {
        if (expectedHash == null || candidateHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expectedHash.getBytes(StandardCharsets.US_ASCII),
                candidateHash.getBytes(StandardCharsets.US_ASCII)
        );
    }
}
