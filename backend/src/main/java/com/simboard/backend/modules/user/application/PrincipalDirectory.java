package com.simboard.backend.modules.user.application;

import java.util.Optional;
import java.util.UUID;

import com.simboard.backend.modules.user.domain.Principal;

/**
 * Read access to principals owned by user management.
 */
public interface PrincipalDirectory {

    Optional<Principal> findById(UUID id);
}
