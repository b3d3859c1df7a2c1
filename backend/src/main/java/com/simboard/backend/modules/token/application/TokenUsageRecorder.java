package com.simboard.backend.modules.token.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.simboard.backend.global.config.AsyncConfig;
import com.simboard.backend.modules.token.infrastructure.persistence.ApiTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Best-effort last_used_at stamping. Runs off the request thread; a failed write never
 * affects the authentication decision.
 */
@Component
public class TokenUsageRecorder {

    private static final Logger log = LoggerFactory.getLogger(TokenUsageRecorder.class);

    private final ApiTokenRepository apiTokenRepository;
    private final TokenProperties properties;

    public TokenUsageRecorder(ApiTokenRepository apiTokenRepository, TokenProperties properties) {
        this.apiTokenRepository = apiTokenRepository;
        this.properties = properties;
    }

    @Async(AsyncConfig.TOKEN_USAGE_EXECUTOR)
    @Transactional
    public void recordUse(UUID tokenId, OffsetDateTime usedAt) {
        if (!properties.trackLastUsed()) {
            return;
        }
        try {
            apiTokenRepository.touchLastUsed(tokenId, usedAt);
        } catch (DataAccessException ex) {
            log.warn("Could not record last use of API token {}: {}", tokenId, ex.getMessage());
        }
    }
}
