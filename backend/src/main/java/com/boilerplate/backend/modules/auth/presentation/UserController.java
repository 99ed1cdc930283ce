package com.boilerplate.backend.modules.auth.presentation;

import com.boilerplate.backend.global.security.RequestIdentity;
import com.boilerplate.backend.global.security.SecurityUtils;
import com.boilerplate.backend.modules.auth.application.AuthService;
import com.boilerplate.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final AuthService authService;

    public UserController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Profile of the user the bearer token was issued to")
    @GetMapping("/me")
    public ResponseEntity<UserResponse> currentUser(@AuthenticationPrincipal RequestIdentity identity) {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.requireUserId(identity)));
    }
}
