package com.simboard.backend.modules.token.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.simboard.backend.modules.audit.application.AuditLogService;
import com.simboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.simboard.backend.modules.token.domain.ApiToken;
import com.simboard.backend.modules.user.application.PrincipalDirectory;
import com.simboard.backend.modules.user.domain.Principal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ApiTokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(ApiTokenIssuer.class);
    private static final String RESOURCE_TYPE = "API_TOKEN";

    private final ApiTokenStore apiTokenStore;
    private final PrincipalDirectory principalDirectory;
    private final TokenSecretGenerator secretGenerator;
    private final TokenDigester tokenDigester;
    private final AuditLogService auditLogService;
    private final TokenProperties properties;
    private final Clock clock;

    public ApiTokenIssuer(
            ApiTokenStore apiTokenStore,
            PrincipalDirectory principalDirectory,
            TokenSecretGenerator secretGenerator,
            TokenDigester tokenDigester,
            AuditLogService auditLogService,
            TokenProperties properties,
            Clock clock
    ) {
        this.apiTokenStore = apiTokenStore;
        this.principalDirectory = principalDirectory;
        this.secretGenerator = secretGenerator;
        this.tokenDigester = tokenDigester;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public IssuedApiToken issue(IssueTokenCommand command, UUID actorId) {
        String name = normalizeName(command.name());
        Principal owner = requireServiceAccountOwner(command.ownerId());
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.expiresAt() != null && !command.expiresAt().isAfter(now)) {
            throw new InvalidExpiryException("expires_at must be in the future");
        }

        for (int attempt = 1; attempt <= properties.maxIssueAttempts(); attempt++) {
            String rawToken = secretGenerator.generate();
            String tokenHash = tokenDigester.digest(rawToken);
            if (apiTokenStore.existsByHash(tokenHash)) {
                log.warn("Token digest collision on issuance attempt {}; regenerating", attempt);
                continue;
            }

            ApiToken token = new ApiToken(name, tokenHash, owner.id(), actorId, now, command.expiresAt());
            UUID tokenId = apiTokenStore.create(token);
            recordIssued(tokenId, owner, actorId, command.expiresAt());
            log.info("Issued API token {} for service account {}", tokenId, owner.id());
            return new IssuedApiToken(token, rawToken);
        }
        throw new IllegalStateException("Could not generate a unique API token after "
                + properties.maxIssueAttempts() + " attempts");
    }

    private String normalizeName(String rawName) {
        String name = rawName == null ? "" : rawName.trim();
        if (name.isEmpty()) {
            throw new InvalidTokenNameException("name must not be blank");
        }
        if (name.length() > properties.nameMaxLength()) {
            throw new InvalidTokenNameException("name must be at most " + properties.nameMaxLength() + " characters");
        }
        return name;
    }

    private Principal requireServiceAccountOwner(UUID ownerId) {
        if (ownerId == null) {
            throw new InvalidOwnerException("owner_id is required");
        }
        Principal owner = principalDirectory.findById(ownerId)
                .orElseThrow(() -> new InvalidOwnerException("Owner does not exist"));
        if (!owner.active()) {
            throw new InvalidOwnerException("Owner is not active");
        }
        if (!owner.isServiceAccount()) {
            throw new InvalidOwnerException("API tokens can only be issued to service accounts");
        }
        return owner;
    }

    private void recordIssued(UUID tokenId, Principal owner, UUID actorId, OffsetDateTime expiresAt) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("ownerId", owner.id().toString());
        detail.put("expiresAt", expiresAt != null ? expiresAt.toString() : null);
        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_TOKEN_ISSUED,
                RESOURCE_TYPE,
                tokenId.toString(),
                actorId,
                detail
        ));
    }

    public record IssueTokenCommand(String name, UUID ownerId, OffsetDateTime expiresAt) {
    }
}
