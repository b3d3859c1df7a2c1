package com.simboard.backend.modules.token.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.tokens")
public record TokenProperties(
        @DefaultValue("sbk_") String prefix,
        @DefaultValue("32") int secretBytes,
        @DefaultValue("3") int maxIssueAttempts,
        @DefaultValue("200") int nameMaxLength,
        @DefaultValue("true") boolean trackLastUsed
) {

    public static final int MIN_SECRET_BYTES = 32;
}
