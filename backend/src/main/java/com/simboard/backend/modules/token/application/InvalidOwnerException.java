package com.simboard.backend.modules.token.application;

import com.simboard.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Token owner is missing, inactive or not a service account.
 */
public class InvalidOwnerException extends ProblemException {

    public static final String CODE = "INVALID_OWNER";

    public InvalidOwnerException(String detail) {
        super(HttpStatus.BAD_REQUEST, CODE, detail);
    }
}
