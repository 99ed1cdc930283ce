package com.boilerplate.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Symmetric signing key built from {@code jwt.key}.
 * A missing key, or one shorter than HS256 allows, leaves the provider unconfigured.
 */
@Component
public class JwtTokenProvider {

    public static final int MIN_KEY_BYTES = 32;
    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.key:}") String key) {
        if (key == null || key.isBlank()) {
            this.secretKey = null;
            return;
        }
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        this.secretKey = keyBytes.length >= MIN_KEY_BYTES ? new SecretKeySpec(keyBytes, HMAC_SHA_256) : null;
    }

    public boolean isConfigured() {
        return secretKey != null;
    }

    public SecretKey getSecretKey() {
        if (secretKey == null) {
            throw new IllegalStateException("JWT signing key is not configured");
        }
        return secretKey;
    }
}
