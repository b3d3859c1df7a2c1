package com.simboard.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.simboard.backend.modules.auth.application.SessionProperties;

import org.springframework.stereotype.Component;

/**
 * HMAC key for the session cookie JWT. Accepts a Base64 secret and falls back to raw UTF-8 bytes.
 */
@Component
public class SessionKeyProvider {

    public static final int MIN_KEY_BYTES = 32;

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public SessionKeyProvider(SessionProperties properties) {
        String secretString = properties.secret();
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("app.session.secret must be configured");
        }
        byte[] keyBytes = decodeSecret(secretString);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("app.session.secret must decode to at least " + MIN_KEY_BYTES
                    + " bytes (got " + keyBytes.length + ")");
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    /**
     * Key material for a configured secret, exactly as the signer will use it.
     */
    public static byte[] decodeSecret(String secretString) {
        try {
            return Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            return secretString.getBytes(StandardCharsets.UTF_8);
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
