package com.simboard.backend.modules.auth.application;

import java.util.Optional;

final class BearerCredentials {

    private static final String BEARER_SCHEME = "Bearer";

    private BearerCredentials() {
    }

    /**
     * Returns the credential of an {@code Authorization: Bearer <token>} header, or empty when the
     * header is absent or uses another scheme. The scheme name is matched case-insensitively.
     */
    static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        String header = authorizationHeader.trim();
        if (header.length() < BEARER_SCHEME.length()
                || !header.regionMatches(true, 0, BEARER_SCHEME, 0, BEARER_SCHEME.length())) {
            return Optional.empty();
        }
        String remainder = header.substring(BEARER_SCHEME.length());
        if (!remainder.isEmpty() && !Character.isWhitespace(remainder.charAt(0))) {
            return Optional.empty();
        }
        return Optional.of(remainder.trim());
    }
}
