package com.simboard.backend.global.error;

import org.springframework.http.HttpStatus;

public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                ProblemException.typeFor(safeCode),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode
        );
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        return of(HttpStatus.valueOf(ex.getStatusCode().value()), ex.getCode(), ex.getDetailMessage(), instance);
    }

    /**
     * Body of every 401, whichever component produces it.
     */
    public static ProblemResponse unauthorized(String instance) {
        return of(ProblemException.unauthorized(), instance);
    }
}
