package com.simboard.backend.modules.auth.domain;

import java.util.Objects;

import com.simboard.backend.modules.user.domain.Principal;

/**
 * Outcome of one authentication mechanism: either a principal with the method that proved it,
 * or a failure reason. Exactly one side is populated.
 */
public record AuthResult(Principal principal, AuthMethod method, AuthFailureReason failureReason) {

    public AuthResult {
        if (principal == null && failureReason == null) {
            throw new IllegalArgumentException("AuthResult needs a principal or a failure reason");
        }
        if (principal != null && failureReason != null) {
            throw new IllegalArgumentException("AuthResult cannot be both authenticated and failed");
        }
    }

    public static AuthResult authenticated(Principal principal, AuthMethod method) {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(method, "method");
        return new AuthResult(principal, method, null);
    }

    public static AuthResult failed(AuthFailureReason reason) {
        Objects.requireNonNull(reason, "reason");
        return new AuthResult(null, null, reason);
    }

    public boolean isAuthenticated() {
        return principal != null;
    }
}
