package com.simboard.backend.modules.token.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.simboard.backend.modules.token.application.IssuedApiToken;

/**
 * Issuance response. The only payload that ever carries the raw token.
 */
public record ApiTokenCreatedResponse(
        UUID id,
        String name,
        String token,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt
) {

    public static ApiTokenCreatedResponse from(IssuedApiToken issued) {
        return new ApiTokenCreatedResponse(
                issued.token().getId(),
                issued.token().getName(),
                issued.rawToken(),
                issued.token().getCreatedAt(),
                issued.token().getExpiresAt()
        );
    }

    @Override
    public String toString() {
        return "ApiTokenCreatedResponse[id=" + id + ", name=" + name + ", token=<redacted>]";
    }
}
