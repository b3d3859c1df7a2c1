package com.simboard.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record CreateServiceAccountRequest(
        @NotBlank(message = "service_name is required")
        @Pattern(regexp = "[a-z0-9][a-z0-9._-]{0,63}", message = "service_name must be lowercase letters, digits, '.', '_' or '-'")
        String serviceName
) {
}
