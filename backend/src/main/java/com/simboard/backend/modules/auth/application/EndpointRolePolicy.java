package com.simboard.backend.modules.auth.application;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.simboard.backend.modules.user.domain.Role;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Allowed roles per protected endpoint, keyed by endpoint name
 * ({@code app.security.endpoint-roles.<key>=ADMIN,USER}).
 */
@ConfigurationProperties(prefix = "app.security")
public class EndpointRolePolicy {

    public static final String TOKENS_MANAGE = "tokens-manage";
    public static final String USERS_ME = "users-me";

    private Map<String, Set<Role>> endpointRoles = new TreeMap<>();

    public Map<String, Set<Role>> getEndpointRoles() {
        return endpointRoles;
    }

    public void setEndpointRoles(Map<String, Set<Role>> endpointRoles) {
        this.endpointRoles = endpointRoles != null ? new TreeMap<>(endpointRoles) : new TreeMap<>();
    }

    /**
     * Unknown endpoints allow nobody.
     */
    public Set<Role> allowedRoles(String endpointKey) {
        Set<Role> roles = endpointRoles.get(endpointKey);
        return roles == null || roles.isEmpty() ? EnumSet.noneOf(Role.class) : EnumSet.copyOf(roles);
    }

    public boolean isConfigured(String endpointKey) {
        return endpointRoles.containsKey(endpointKey);
    }
}
