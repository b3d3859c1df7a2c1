package com.simboard.backend.modules.token.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CreateApiTokenRequest(
        String name,
        UUID ownerId,
        OffsetDateTime expiresAt
) {
}
