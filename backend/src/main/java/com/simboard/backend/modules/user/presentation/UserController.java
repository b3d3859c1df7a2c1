package com.simboard.backend.modules.user.presentation;

import com.simboard.backend.global.security.AuthenticatedPrincipal;
import com.simboard.backend.global.security.GuardedEndpoint;
import com.simboard.backend.modules.auth.application.EndpointRolePolicy;
import com.simboard.backend.modules.user.presentation.dto.CurrentUserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Users")
public class UserController {

    @GetMapping("/users/me")
    @GuardedEndpoint(EndpointRolePolicy.USERS_ME)
    @Operation(summary = "Identity resolved for the current request")
    public ResponseEntity<CurrentUserResponse> currentUser(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(CurrentUserResponse.from(principal));
    }
}
