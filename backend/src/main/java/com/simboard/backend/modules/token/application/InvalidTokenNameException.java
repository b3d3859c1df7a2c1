package com.simboard.backend.modules.token.application;

import com.simboard.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class InvalidTokenNameException extends ProblemException {

    public static final String CODE = "INVALID_TOKEN_NAME";

    public InvalidTokenNameException(String detail) {
        super(HttpStatus.BAD_REQUEST, CODE, detail);
    }
}
