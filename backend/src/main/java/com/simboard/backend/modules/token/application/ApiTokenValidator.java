package com.simboard.backend.modules.token.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.simboard.backend.modules.auth.domain.AuthFailureReason;
import com.simboard.backend.modules.auth.domain.AuthMethod;
import com.simboard.backend.modules.auth.domain.AuthResult;
import com.simboard.backend.modules.token.domain.ApiToken;
import com.simboard.backend.modules.user.application.PrincipalDirectory;
import com.simboard.backend.modules.user.domain.Principal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Resolves a raw bearer secret to its owning service account.
 *
 * <p>Every lookup goes to the store; there is no validity cache, so a committed revocation
 * applies to the very next request. Failure reasons stay internal: callers only learn
 * authenticated or not.
 */
@Service
public class ApiTokenValidator {

    private static final Logger log = LoggerFactory.getLogger(ApiTokenValidator.class);

    private final ApiTokenStore apiTokenStore;
    private final PrincipalDirectory principalDirectory;
    private final TokenSecretGenerator secretGenerator;
    private final TokenDigester tokenDigester;
    private final TokenUsageRecorder usageRecorder;
    private final Clock clock;

    public ApiTokenValidator(
            ApiTokenStore apiTokenStore,
            PrincipalDirectory principalDirectory,
            TokenSecretGenerator secretGenerator,
            TokenDigester tokenDigester,
            TokenUsageRecorder usageRecorder,
            Clock clock
    ) {
        this.apiTokenStore = apiTokenStore;
        this.principalDirectory = principalDirectory;
        this.secretGenerator = secretGenerator;
        this.tokenDigester = tokenDigester;
        this.usageRecorder = usageRecorder;
        this.clock = clock;
    }

    public AuthResult validate(String rawToken) {
        if (!secretGenerator.looksLikeToken(rawToken)) {
            return reject(AuthFailureReason.TOKEN_MALFORMED, null);
        }

        String tokenHash = tokenDigester.digest(rawToken);
        Optional<ApiToken> match;
        try {
            match = apiTokenStore.findByHash(tokenHash);
        } catch (DataAccessException ex) {
            log.warn("API token lookup failed; treating request as unauthenticated", ex);
            return AuthResult.failed(AuthFailureReason.STORE_UNAVAILABLE);
        }

        if (match.isEmpty() || !tokenDigester.matches(tokenHash, match.get().getTokenHash())) {
            return reject(AuthFailureReason.TOKEN_NOT_FOUND, null);
        }
        ApiToken token = match.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        switch (token.stateAt(now)) {
            case REVOKED:
                return reject(AuthFailureReason.TOKEN_REVOKED, token);
            case EXPIRED:
                return reject(AuthFailureReason.TOKEN_EXPIRED, token);
            default:
                break;
        }

        Optional<Principal> owner;
        try {
            owner = principalDirectory.findById(token.getOwnerId());
        } catch (DataAccessException ex) {
            log.warn("Owner lookup for API token {} failed; treating request as unauthenticated", token.getId(), ex);
            return AuthResult.failed(AuthFailureReason.STORE_UNAVAILABLE);
        }
        if (owner.isEmpty()) {
            return reject(AuthFailureReason.OWNER_UNAVAILABLE, token);
        }
        if (!owner.get().isServiceAccount()) {
            log.error("ALARM: API token {} resolves to principal {} with role {}",
                    token.getId(), owner.get().id(), owner.get().role());
            return AuthResult.failed(AuthFailureReason.INTEGRITY_VIOLATION);
        }
        if (!owner.get().active()) {
            return reject(AuthFailureReason.OWNER_INACTIVE, token);
        }

        try {
            usageRecorder.recordUse(token.getId(), now);
        } catch (TaskRejectedException ex) {
            log.debug("Skipped last-used stamp for API token {}: usage queue is full", token.getId());
        }
        return AuthResult.authenticated(owner.get(), AuthMethod.API_TOKEN);
    }

    private AuthResult reject(AuthFailureReason reason, ApiToken token) {
        if (token != null) {
            log.info("Rejected API token {}: {}", token.getId(), reason);
        } else {
            log.debug("Rejected bearer credential: {}", reason);
        }
        return AuthResult.failed(reason);
    }
}
