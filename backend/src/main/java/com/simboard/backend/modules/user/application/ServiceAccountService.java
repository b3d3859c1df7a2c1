package com.simboard.backend.modules.user.application;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.simboard.backend.modules.audit.application.AuditLogService;
import com.simboard.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.simboard.backend.modules.user.domain.AppUser;
import com.simboard.backend.modules.user.domain.Principal;
import com.simboard.backend.modules.user.domain.Role;
import com.simboard.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Idempotent provisioning of service account principals ({@code <service>@<domain>}).
 */
@Service
public class ServiceAccountService {

    private static final Logger log = LoggerFactory.getLogger(ServiceAccountService.class);

    private final AppUserRepository appUserRepository;
    private final AuditLogService auditLogService;
    private final ServiceAccountProperties properties;

    public ServiceAccountService(
            AppUserRepository appUserRepository,
            AuditLogService auditLogService,
            ServiceAccountProperties properties
    ) {
        this.appUserRepository = appUserRepository;
        this.auditLogService = auditLogService;
        this.properties = properties;
    }

    @Transactional
    public ServiceAccountResult ensureServiceAccount(String serviceName, UUID actorId) {
        String email = serviceName.trim().toLowerCase(Locale.ROOT) + "@" + properties.domain();

        Optional<AppUser> existing = appUserRepository.findByEmailIgnoreCase(email);
        if (existing.isPresent()) {
            return new ServiceAccountResult(existing.get().toPrincipal(), false);
        }

        AppUser account = new AppUser();
        account.setEmail(email);
        account.setRole(Role.SERVICE_ACCOUNT);
        account.setActive(true);
        AppUser saved = appUserRepository.saveAndFlush(account);

        auditLogService.record(new AuditLogCommand(
                AuditLogService.ACTION_SERVICE_ACCOUNT_CREATED,
                "PRINCIPAL",
                saved.getId().toString(),
                actorId,
                Map.of("email", email)
        ));
        log.info("Created service account {} ({})", saved.getId(), email);
        return new ServiceAccountResult(saved.toPrincipal(), true);
    }

    public record ServiceAccountResult(Principal principal, boolean created) {
    }
}
