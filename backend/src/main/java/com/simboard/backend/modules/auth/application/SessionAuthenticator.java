package com.simboard.backend.modules.auth.application;

import com.simboard.backend.modules.auth.domain.AuthResult;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Contract of the OAuth/session subsystem: resolve the ambient browser credential of a request.
 */
public interface SessionAuthenticator {

    AuthResult authenticate(HttpServletRequest request);
}
