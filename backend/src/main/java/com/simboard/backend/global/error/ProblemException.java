package com.simboard.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Error with a stable machine-readable code, rendered as {@link ProblemResponse}.
 * The detail is shown to callers, so it must never carry credentials or digests.
 */
public class ProblemException extends ResponseStatusException {

    private static final String TYPE_PREFIX = "urn:problem:simboard:";
    static final String UNAUTHORIZED_CODE = "unauthorized";
    static final String UNAUTHORIZED_DETAIL = "Authentication required";

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : status.getReasonPhrase();
    }

    /**
     * The one 401 every authentication failure maps to.
     */
    public static ProblemException unauthorized() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, UNAUTHORIZED_CODE, UNAUTHORIZED_DETAIL);
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return typeFor(code);
    }

    static String typeFor(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "-");
    }
}
