package com.simboard.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.simboard.backend.modules.auth.application.AuthResolver;
import com.simboard.backend.modules.auth.domain.AuthResult;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs {@link AuthResolver} once per request. A failed resolution leaves the request anonymous so
 * the entry point answers 401 on protected routes without revealing why.
 */
@Component
public class AuthResolutionFilter extends OncePerRequestFilter {

    public static final String FAILURE_REASON_ATTRIBUTE = AuthResolutionFilter.class.getName() + ".failureReason";

    private static final Logger log = LoggerFactory.getLogger(AuthResolutionFilter.class);

    private final AuthResolver authResolver;

    public AuthResolutionFilter(AuthResolver authResolver) {
        this.authResolver = authResolver;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        AuthResult result = authResolver.resolve(request);
        if (result.isAuthenticated()) {
            AuthenticatedPrincipal principal = AuthenticatedPrincipal.of(result.principal(), result.method());
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    principal,
                    null,
                    List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name()))
            );
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContext context = SecurityContextHolder.createEmptyContext();
            context.setAuthentication(authentication);
            SecurityContextHolder.setContext(context);
        } else {
            SecurityContextHolder.clearContext();
            request.setAttribute(FAILURE_REASON_ATTRIBUTE, result.failureReason());
            log.debug("Request {} {} unauthenticated: {}", request.getMethod(), request.getRequestURI(), result.failureReason());
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return SecurityConfig.isPublicPath(path);
    }
}
