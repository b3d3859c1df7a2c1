package com.simboard.backend.modules.token.domain;

/**
 * ACTIVE and REVOKED are stored; EXPIRED is derived from expires_at at read time.
 */
public enum ApiTokenState {
    ACTIVE,
    REVOKED,
    EXPIRED
}
