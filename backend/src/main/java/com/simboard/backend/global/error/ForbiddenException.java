package com.simboard.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * The caller is authenticated but its role is not allowed on the endpoint.
 */
public class ForbiddenException extends ProblemException {

    public static final String CODE = "FORBIDDEN";

    public ForbiddenException(String detail) {
        super(HttpStatus.FORBIDDEN, CODE, detail);
    }
}
