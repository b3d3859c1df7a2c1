package com.simboard.backend.modules.user.presentation.dto;

import java.util.UUID;

import com.simboard.backend.modules.user.application.ServiceAccountService.ServiceAccountResult;
import com.simboard.backend.modules.user.domain.Role;

public record ServiceAccountResponse(UUID id, String email, Role role, boolean created) {

    public static ServiceAccountResponse from(ServiceAccountResult result) {
        return new ServiceAccountResponse(
                result.principal().id(),
                result.principal().email(),
                result.principal().role(),
                result.created()
        );
    }
}
