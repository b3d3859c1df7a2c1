package com.simboard.backend.modules.auth.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.session")
public record SessionProperties(
        String secret,
        @DefaultValue("simboard_session") String cookieName,
        @DefaultValue("PT1H") Duration ttl
) {
}
