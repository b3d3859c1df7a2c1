package com.simboard.backend.modules.user.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Read-only snapshot of an identity as seen by the authentication core.
 */
public record Principal(UUID id, String email, Role role, boolean active) {

    public Principal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
    }

    public boolean isServiceAccount() {
        return role == Role.SERVICE_ACCOUNT;
    }
}
