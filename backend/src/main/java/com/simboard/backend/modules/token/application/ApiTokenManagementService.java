package com.simboard.backend.modules.token.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.simboard.backend.modules.audit.application.AuditLogService;
import com.simboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ApiTokenManagementService {

    private static final Logger log = LoggerFactory.getLogger(ApiTokenManagementService.class);

    private final ApiTokenStore apiTokenStore;
    private final AuditLogService auditLogService;

    public ApiTokenManagementService(ApiTokenStore apiTokenStore, AuditLogService auditLogService) {
        this.apiTokenStore = apiTokenStore;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<ApiTokenSummary> list(UUID ownerFilter) {
        return apiTokenStore.list(ownerFilter);
    }

    @Transactional
    public void revoke(UUID tokenId, UUID actorId) {
        boolean transitioned = apiTokenStore.revoke(tokenId);
        if (!transitioned) {
            log.debug("API token {} was already revoked", tokenId);
            return;
        }
        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_TOKEN_REVOKED,
                "API_TOKEN",
                tokenId.toString(),
                actorId,
                Map.of()
        ));
        log.info("Revoked API token {}", tokenId);
    }
}
