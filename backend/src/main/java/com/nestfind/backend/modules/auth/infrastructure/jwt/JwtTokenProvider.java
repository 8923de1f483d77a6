package com.nestfind.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the symmetric signing key and the configured HMAC algorithm for access tokens.
 */
@Component
public class JwtTokenProvider {

    private final SecretKey signingKey;
    private final MacAlgorithm algorithm;

    public JwtTokenProvider(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.algorithm:HS256}") String algorithmId
    ) {
        this.algorithm = resolveAlgorithm(algorithmId);
        this.signingKey = new SecretKeySpec(decodeSecret(secret), algorithm.getJcaName());
    }

    public SecretKey getSigningKey() {
        return signingKey;
    }

    public MacAlgorithm getAlgorithm() {
        return algorithm;
    }

    private static MacAlgorithm resolveAlgorithm(String algorithmId) {
        if (Jwts.SIG.get().get(algorithmId) instanceof MacAlgorithm mac) {
            return mac;
        }
        throw new IllegalArgumentException("jwt.algorithm must be an HMAC algorithm (HS256, HS384, HS512): " + algorithmId);
    }

    private static byte[] decodeSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("jwt.secret must be configured");
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException notBase64) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
        if (decoded.length >= 32) {
            return decoded;
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }
}
