package com.simboard.backend.global.security;

import java.security.Principal;

import com.simboard.backend.global.error.ProblemException;
import com.simboard.backend.modules.auth.application.RoleGuard;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Applies {@link RoleGuard} to handlers carrying {@link GuardedEndpoint}, reading the identity
 * from the request rather than from a global holder.
 */
@Component
public class RoleGuardInterceptor implements HandlerInterceptor {

    private final RoleGuard roleGuard;

    public RoleGuardInterceptor(RoleGuard roleGuard) {
        this.roleGuard = roleGuard;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        GuardedEndpoint guarded = handlerMethod.getMethodAnnotation(GuardedEndpoint.class);
        if (guarded == null) {
            guarded = handlerMethod.getBeanType().getAnnotation(GuardedEndpoint.class);
        }
        if (guarded == null) {
            return true;
        }

        AuthenticatedPrincipal principal = resolvePrincipal(request.getUserPrincipal());
        if (principal == null) {
            throw ProblemException.unauthorized();
        }
        roleGuard.check(principal.role(), guarded.value());
        return true;
    }

    private AuthenticatedPrincipal resolvePrincipal(Principal userPrincipal) {
        if (userPrincipal instanceof Authentication authentication
                && authentication.getPrincipal() instanceof AuthenticatedPrincipal principal) {
            return principal;
        }
        return null;
    }
}
