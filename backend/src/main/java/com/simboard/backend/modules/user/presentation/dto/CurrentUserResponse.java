package com.simboard.backend.modules.user.presentation.dto;

import java.util.UUID;

import com.simboard.backend.global.security.AuthenticatedPrincipal;
import com.simboard.backend.modules.auth.domain.AuthMethod;
import com.simboard.backend.modules.user.domain.Role;

public record CurrentUserResponse(UUID id, String email, Role role, AuthMethod authMethod) {

    public static CurrentUserResponse from(AuthenticatedPrincipal principal) {
        return new CurrentUserResponse(principal.id(), principal.email(), principal.role(), principal.authMethod());
    }
}
