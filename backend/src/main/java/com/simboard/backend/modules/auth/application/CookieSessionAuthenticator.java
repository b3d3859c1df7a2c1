package com.simboard.backend.modules.auth.application;

import java.util.Optional;

import com.simboard.backend.modules.auth.application.SessionTokenService.InvalidSessionException;
import com.simboard.backend.modules.auth.application.SessionTokenService.ParsedSession;
import com.simboard.backend.modules.auth.domain.AuthFailureReason;
import com.simboard.backend.modules.auth.domain.AuthMethod;
import com.simboard.backend.modules.auth.domain.AuthResult;
import com.simboard.backend.modules.user.application.PrincipalDirectory;
import com.simboard.backend.modules.user.domain.Principal;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class CookieSessionAuthenticator implements SessionAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(CookieSessionAuthenticator.class);

    private final SessionTokenService sessionTokenService;
    private final PrincipalDirectory principalDirectory;
    private final SessionProperties properties;

    public CookieSessionAuthenticator(
            SessionTokenService sessionTokenService,
            PrincipalDirectory principalDirectory,
            SessionProperties properties
    ) {
        this.sessionTokenService = sessionTokenService;
        this.principalDirectory = principalDirectory;
        this.properties = properties;
    }

    @Override
    public AuthResult authenticate(HttpServletRequest request) {
        String sessionToken = readSessionCookie(request);
        if (sessionToken == null) {
            return AuthResult.failed(AuthFailureReason.SESSION_MISSING);
        }

        ParsedSession session;
        try {
            session = sessionTokenService.parse(sessionToken);
        } catch (InvalidSessionException ex) {
            log.debug("Rejected session cookie: {}", ex.getCause() != null ? ex.getCause().getClass().getSimpleName() : ex.getMessage());
            return AuthResult.failed(AuthFailureReason.SESSION_INVALID);
        }

        Optional<Principal> principal;
        try {
            principal = principalDirectory.findById(session.userId());
        } catch (DataAccessException ex) {
            log.warn("Principal lookup failed during session resolution", ex);
            return AuthResult.failed(AuthFailureReason.STORE_UNAVAILABLE);
        }

        if (principal.isEmpty() || !principal.get().active()) {
            log.debug("Session principal {} missing or inactive", session.userId());
            return AuthResult.failed(AuthFailureReason.SESSION_PRINCIPAL_REJECTED);
        }
        // Service accounts have no OAuth identity; a session naming one is forged or stale.
        if (principal.get().isServiceAccount()) {
            log.warn("Session credential names service account {}", session.userId());
            return AuthResult.failed(AuthFailureReason.SESSION_PRINCIPAL_REJECTED);
        }
        return AuthResult.authenticated(principal.get(), AuthMethod.SESSION);
    }

    private String readSessionCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (properties.cookieName().equals(cookie.getName()) && StringUtils.hasText(cookie.getValue())) {
                return cookie.getValue();
            }
        }
        return null;
    }
}
