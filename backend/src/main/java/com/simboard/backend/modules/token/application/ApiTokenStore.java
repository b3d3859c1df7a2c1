package com.simboard.backend.modules.token.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.simboard.backend.modules.token.domain.ApiToken;
import com.simboard.backend.modules.token.infrastructure.persistence.ApiTokenRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistence boundary for API tokens. Rows are never deleted and the only mutation is
 * the one-way revoke.
 */
@Component
public class ApiTokenStore {

    private final ApiTokenRepository apiTokenRepository;
    private final Clock clock;

    public ApiTokenStore(ApiTokenRepository apiTokenRepository, Clock clock) {
        this.apiTokenRepository = apiTokenRepository;
        this.clock = clock;
    }

    @Transactional
    public UUID create(ApiToken token) {
        return apiTokenRepository.saveAndFlush(token).getId();
    }

    @Transactional(readOnly = true)
    public Optional<ApiToken> findByHash(String tokenHash) {
        return apiTokenRepository.findByTokenHash(tokenHash);
    }

    @Transactional(readOnly = true)
    public boolean existsByHash(String tokenHash) {
        return apiTokenRepository.existsByTokenHash(tokenHash);
    }

    /**
     * Newest first. A {@code null} owner lists every token.
     */
    @Transactional(readOnly = true)
    public List<ApiTokenSummary> list(UUID ownerFilter) {
        return ownerFilter == null
                ? apiTokenRepository.findAllSummaries()
                : apiTokenRepository.findSummariesByOwner(ownerFilter);
    }

    /**
     * Marks the token revoked. Returns {@code true} when this call performed the transition and
     * {@code false} when the token was already revoked.
     *
     * @throws ApiTokenNotFoundException when no token has the id
     */
    @Transactional
    public boolean revoke(UUID id) {
        int updated = apiTokenRepository.revokeIfActive(id, OffsetDateTime.now(clock));
        if (updated > 0) {
            return true;
        }
        if (!apiTokenRepository.existsById(id)) {
            throw new ApiTokenNotFoundException(id);
        }
        return false;
    }
}
