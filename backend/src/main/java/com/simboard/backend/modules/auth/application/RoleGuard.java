package com.simboard.backend.modules.auth.application;

import java.util.Set;

import com.simboard.backend.global.error.ForbiddenException;
import com.simboard.backend.modules.user.domain.Role;

import jakarta.annotation.PostConstruct;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Post-authentication role check against an endpoint's allowed-role set.
 */
@Component
public class RoleGuard {

    private static final Logger log = LoggerFactory.getLogger(RoleGuard.class);

    private final EndpointRolePolicy policy;

    public RoleGuard(EndpointRolePolicy policy) {
        this.policy = policy;
    }

    @PostConstruct
    void verifyTokenManagementIsAdminOnly() {
        Set<Role> roles = policy.allowedRoles(EndpointRolePolicy.TOKENS_MANAGE);
        if (!roles.equals(Set.of(Role.ADMIN))) {
            throw new IllegalStateException("app.security.endpoint-roles." + EndpointRolePolicy.TOKENS_MANAGE
                    + " must be exactly [ADMIN] but was " + roles);
        }
    }

    /**
     * @throws ForbiddenException when {@code role} is not allowed on {@code endpointKey}
     */
    public void check(Role role, String endpointKey) {
        Set<Role> allowed = policy.allowedRoles(endpointKey);
        if (!policy.isConfigured(endpointKey)) {
            log.warn("No role policy configured for endpoint '{}'; denying", endpointKey);
        }
        if (role == null || !allowed.contains(role)) {
            throw new ForbiddenException("Role " + role + " may not access this endpoint");
        }
    }
}
