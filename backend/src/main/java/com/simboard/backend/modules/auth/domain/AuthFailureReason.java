package com.simboard.backend.modules.auth.domain;

/**
 * Internal reason an authentication attempt failed. Used for logs only; every value maps to
 * the same generic 401 on the wire.
 */
public enum AuthFailureReason {
    NO_CREDENTIALS,
    SESSION_MISSING,
    SESSION_INVALID,
    SESSION_PRINCIPAL_REJECTED,
    TOKEN_MALFORMED,
    TOKEN_NOT_FOUND,
    TOKEN_REVOKED,
    TOKEN_EXPIRED,
    OWNER_UNAVAILABLE,
    OWNER_INACTIVE,
    INTEGRITY_VIOLATION,
    STORE_UNAVAILABLE
}
