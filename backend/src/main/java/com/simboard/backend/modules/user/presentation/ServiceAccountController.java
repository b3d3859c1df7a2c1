package com.simboard.backend.modules.user.presentation;

import com.simboard.backend.global.security.AuthenticatedPrincipal;
import com.simboard.backend.global.security.GuardedEndpoint;
import com.simboard.backend.modules.auth.application.EndpointRolePolicy;
import com.simboard.backend.modules.user.application.ServiceAccountService;
import com.simboard.backend.modules.user.application.ServiceAccountService.ServiceAccountResult;
import com.simboard.backend.modules.user.presentation.dto.CreateServiceAccountRequest;
import com.simboard.backend.modules.user.presentation.dto.ServiceAccountResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "API Tokens")
public class ServiceAccountController {

    private final ServiceAccountService serviceAccountService;

    public ServiceAccountController(ServiceAccountService serviceAccountService) {
        this.serviceAccountService = serviceAccountService;
    }

    @PostMapping("/tokens/service-accounts")
    @GuardedEndpoint(EndpointRolePolicy.TOKENS_MANAGE)
    @Operation(summary = "Create a service account if it does not exist yet")
    @ApiResponse(responseCode = "201", description = "Service account created")
    @ApiResponse(responseCode = "200", description = "Service account already existed")
    public ResponseEntity<ServiceAccountResponse> create(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @Valid @RequestBody CreateServiceAccountRequest request
    ) {
        ServiceAccountResult result = serviceAccountService.ensureServiceAccount(request.serviceName(), principal.id());
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(ServiceAccountResponse.from(result));
    }
}
