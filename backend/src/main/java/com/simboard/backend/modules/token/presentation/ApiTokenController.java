package com.simboard.backend.modules.token.presentation;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import com.simboard.backend.global.security.AuthenticatedPrincipal;
import com.simboard.backend.global.security.GuardedEndpoint;
import com.simboard.backend.modules.auth.application.EndpointRolePolicy;
import com.simboard.backend.modules.token.application.ApiTokenIssuer;
import com.simboard.backend.modules.token.application.ApiTokenIssuer.IssueTokenCommand;
import com.simboard.backend.modules.token.application.ApiTokenManagementService;
import com.simboard.backend.modules.token.application.IssuedApiToken;
import com.simboard.backend.modules.token.presentation.dto.ApiTokenCreatedResponse;
import com.simboard.backend.modules.token.presentation.dto.ApiTokenResponse;
import com.simboard.backend.modules.token.presentation.dto.CreateApiTokenRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tokens")
@GuardedEndpoint(EndpointRolePolicy.TOKENS_MANAGE)
@Tag(name = "API Tokens", description = "Issue, list and revoke service account API tokens")
public class ApiTokenController {

    private final ApiTokenIssuer apiTokenIssuer;
    private final ApiTokenManagementService apiTokenManagementService;

    public ApiTokenController(ApiTokenIssuer apiTokenIssuer, ApiTokenManagementService apiTokenManagementService) {
        this.apiTokenIssuer = apiTokenIssuer;
        this.apiTokenManagementService = apiTokenManagementService;
    }

    @PostMapping
    @Operation(summary = "Issue an API token", description = "The raw token is returned in this response only.")
    @ApiResponse(responseCode = "201", description = "Token issued")
    @ApiResponse(responseCode = "400", description = "Invalid owner, expiry or name")
    public ResponseEntity<ApiTokenCreatedResponse> create(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @RequestBody CreateApiTokenRequest request
    ) {
        IssuedApiToken issued = apiTokenIssuer.issue(
                new IssueTokenCommand(request.name(), request.ownerId(), request.expiresAt()),
                principal.id()
        );
        return ResponseEntity.created(URI.create("/tokens/" + issued.token().getId()))
                .cacheControl(CacheControl.noStore())
                .body(ApiTokenCreatedResponse.from(issued));
    }

    @GetMapping
    @Operation(summary = "List API tokens, newest first")
    public ResponseEntity<List<ApiTokenResponse>> list(
            @Parameter(description = "Only tokens owned by this principal")
            @RequestParam(name = "owner_id", required = false) UUID ownerId
    ) {
        List<ApiTokenResponse> tokens = apiTokenManagementService.list(ownerId).stream()
                .map(ApiTokenResponse::from)
                .toList();
        return ResponseEntity.ok(tokens);
    }

    @DeleteMapping("/{tokenId}")
    @Operation(summary = "Revoke an API token", description = "Idempotent; revoked tokens are kept for audit.")
    @ApiResponse(responseCode = "204", description = "Token revoked")
    @ApiResponse(responseCode = "404", description = "Unknown token")
    public ResponseEntity<Void> revoke(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @PathVariable UUID tokenId
    ) {
        apiTokenManagementService.revoke(tokenId, principal.id());
        return ResponseEntity.noContent().build();
    }
}
