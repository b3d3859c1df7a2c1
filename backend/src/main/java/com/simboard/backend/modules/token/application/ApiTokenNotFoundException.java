package com.simboard.backend.modules.token.application;

import java.util.UUID;

import com.simboard.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class ApiTokenNotFoundException extends ProblemException {

    public ApiTokenNotFoundException(UUID tokenId) {
        super(HttpStatus.NOT_FOUND, "TOKEN_NOT_FOUND", "No API token with id " + tokenId);
    }
}
