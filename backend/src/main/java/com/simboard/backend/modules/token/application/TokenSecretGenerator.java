package com.simboard.backend.modules.token.application;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

/**
 * Produces raw token secrets: the configured prefix followed by URL-safe Base64 of
 * {@code secretBytes} random bytes.
 */
@Component
public class TokenSecretGenerator {

    private final SecureRandom secureRandom;
    private final TokenProperties properties;

    public TokenSecretGenerator(TokenProperties properties) {
        this(properties, new SecureRandom());
    }

    TokenSecretGenerator(TokenProperties properties, SecureRandom secureRandom) {
        if (properties.secretBytes() < TokenProperties.MIN_SECRET_BYTES) {
            throw new IllegalStateException("app.tokens.secret-bytes must be >= " + TokenProperties.MIN_SECRET_BYTES);
        }
        this.properties = properties;
        this.secureRandom = secureRandom;
    }

    public String generate() {
        byte[] bytes = new byte[properties.secretBytes()];
        secureRandom.nextBytes(bytes);
        return properties.prefix() + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Cheap shape check before any digest or lookup work. Not a security boundary.
     */
    public boolean looksLikeToken(String candidate) {
        if (candidate == null || !candidate.startsWith(properties.prefix())) {
            return false;
        }
        String body = candidate.substring(properties.prefix().length());
        if (body.length() != expectedBodyLength()) {
            return false;
        }
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            boolean urlSafe = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '-' || c == '_';
            if (!urlSafe) {
                return false;
            }
        }
        return true;
    }

    private int expectedBodyLength() {
        int bytes = properties.secretBytes();
        return (bytes * 4 + 2) / 3;
    }
}
