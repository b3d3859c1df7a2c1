package com.simboard.backend.modules.user.domain;

/**
 * Coarse role of a principal. Only {@link #SERVICE_ACCOUNT} principals may own API tokens,
 * and they never authenticate through the browser session.
 */
public enum Role {
    USER,
    ADMIN,
    SERVICE_ACCOUNT
}
