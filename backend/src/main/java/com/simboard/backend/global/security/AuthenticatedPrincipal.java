package com.simboard.backend.global.security;

import java.util.UUID;

import com.simboard.backend.modules.auth.domain.AuthMethod;
import com.simboard.backend.modules.user.domain.Principal;
import com.simboard.backend.modules.user.domain.Role;

/**
 * Identity handed to controllers for the current request, together with how it was proven.
 */
public record AuthenticatedPrincipal(UUID id, String email, Role role, AuthMethod authMethod) {

    public static AuthenticatedPrincipal of(Principal principal, AuthMethod method) {
        return new AuthenticatedPrincipal(principal.id(), principal.email(), principal.role(), method);
    }
}
