package com.simboard.backend.modules.auth.application;

import java.util.Optional;

import com.simboard.backend.modules.auth.domain.AuthFailureReason;
import com.simboard.backend.modules.auth.domain.AuthMethod;
import com.simboard.backend.modules.auth.domain.AuthResult;
import com.simboard.backend.modules.token.application.ApiTokenValidator;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Per-request authentication: the browser session is tried first and unconditionally; the
 * API token path runs only when the session fails and a Bearer header is present. A session
 * that resolves is never overridden by a Bearer header on the same request.
 */
@Service
public class AuthResolver {

    private static final Logger log = LoggerFactory.getLogger(AuthResolver.class);

    private final SessionAuthenticator sessionAuthenticator;
    private final ApiTokenValidator apiTokenValidator;

    public AuthResolver(SessionAuthenticator sessionAuthenticator, ApiTokenValidator apiTokenValidator) {
        this.sessionAuthenticator = sessionAuthenticator;
        this.apiTokenValidator = apiTokenValidator;
    }

    public AuthResult resolve(HttpServletRequest request) {
        AuthResult session = sessionAuthenticator.authenticate(request);
        if (session.isAuthenticated()) {
            return session;
        }

        Optional<String> bearer = BearerCredentials.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (bearer.isEmpty()) {
            return session.failureReason() == AuthFailureReason.SESSION_MISSING
                    ? AuthResult.failed(AuthFailureReason.NO_CREDENTIALS)
                    : session;
        }

        AuthResult token = apiTokenValidator.validate(bearer.get());
        if (!token.isAuthenticated()) {
            return token;
        }
        if (token.method() != AuthMethod.API_TOKEN || !token.principal().isServiceAccount()) {
            log.error("ALARM: token authentication produced non service account principal {} ({})",
                    token.principal().id(), token.principal().role());
            return AuthResult.failed(AuthFailureReason.INTEGRITY_VIOLATION);
        }
        return token;
    }
}
