package com.simboard.backend.modules.user.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.service-accounts")
public record ServiceAccountProperties(@DefaultValue("simboard.local") String domain) {
}
