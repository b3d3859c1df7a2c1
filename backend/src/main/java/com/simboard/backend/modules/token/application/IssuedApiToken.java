package com.simboard.backend.modules.token.application;

import com.simboard.backend.modules.token.domain.ApiToken;

/**
 * Result of issuance. {@code rawToken} exists only in this object and the 201 response body.
 */
public record IssuedApiToken(ApiToken token, String rawToken) {

    @Override
    public String toString() {
        return "IssuedApiToken[id=" + token.getId() + ", rawToken=<redacted>]";
    }
}
