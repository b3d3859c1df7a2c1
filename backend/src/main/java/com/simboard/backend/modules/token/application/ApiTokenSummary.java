package com.simboard.backend.modules.token.application;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Listing view of a token. Deliberately has no field for the digest.
 */
public record ApiTokenSummary(
        UUID id,
        String name,
        UUID ownerId,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        boolean revoked
) {
}
