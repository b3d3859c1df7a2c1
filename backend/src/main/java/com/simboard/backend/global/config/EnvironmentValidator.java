package com.simboard.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.simboard.backend.modules.auth.infrastructure.jwt.SessionKeyProvider;
import com.simboard.backend.modules.token.application.TokenProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or still carry development defaults.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SESSION_SECRET = "dev-session-secret-change-me-before-deploying-simboard";
    private static final List<String> RELAXED_PROFILES = List.of("dev", "test");

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "app.session.secret",
            "app.service-accounts.domain",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                problems.add(property + ": missing");
            }
        }

        Optional<String> sessionSecret = Optional.ofNullable(environment.getProperty("app.session.secret"))
                .filter(secret -> !secret.isBlank());
        if (sessionSecret.filter(PLACEHOLDER_SESSION_SECRET::equals).isPresent() && !isRelaxedProfile()) {
            problems.add("app.session.secret: replace the development placeholder with a random value");
        }
        if (sessionSecret.filter(secret -> SessionKeyProvider.decodeSecret(secret).length < SessionKeyProvider.MIN_KEY_BYTES)
                .isPresent()) {
            problems.add("app.session.secret: must be at least " + SessionKeyProvider.MIN_KEY_BYTES + " bytes");
        }

        Integer secretBytes = environment.getProperty("app.tokens.secret-bytes", Integer.class);
        if (secretBytes != null && secretBytes < TokenProperties.MIN_SECRET_BYTES) {
            problems.add("app.tokens.secret-bytes: must be at least " + TokenProperties.MIN_SECRET_BYTES);
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment check failed: {}", problem));
            throw new IllegalStateException("Invalid environment configuration: " + String.join("; ", problems));
        }
        log.info("Environment check passed (profiles={})", Arrays.toString(environment.getActiveProfiles()));
    }

    // Default profiles never relax the check; dev and test have to be activated explicitly.
    private boolean isRelaxedProfile() {
        return Arrays.stream(environment.getActiveProfiles()).anyMatch(RELAXED_PROFILES::contains);
    }
}
