package com.simboard.backend.modules.token.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.simboard.backend.modules.token.application.ApiTokenSummary;

public record ApiTokenResponse(
        UUID id,
        String name,
        UUID ownerId,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        boolean revoked
) {

    public static ApiTokenResponse from(ApiTokenSummary summary) {
        return new ApiTokenResponse(
                summary.id(),
                summary.name(),
                summary.ownerId(),
                summary.createdAt(),
                summary.expiresAt(),
                summary.revoked()
        );
    }
}
