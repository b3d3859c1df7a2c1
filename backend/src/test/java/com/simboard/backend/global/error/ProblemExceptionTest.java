package com.simboard.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ProblemExceptionTest {

    private final Locale originalLocale = Locale.getDefault();

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(originalLocale);
    }

    @Test
    void problemTypeIsStableUnderTurkishLocale() {
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        ProblemException ex = new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_TOKEN_NAME", "Name is blank");

        assertThat(ex.getProblemType()).isEqualTo("urn:problem:simboard:invalid_token_name");
    }

    @Test
    void unauthorizedIsGeneric() {
        ProblemException ex = ProblemException.unauthorized();

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(ex.getCode()).isEqualTo("unauthorized");
        assertThat(ex.getDetailMessage()).isEqualTo("Authentication required");
    }
}
