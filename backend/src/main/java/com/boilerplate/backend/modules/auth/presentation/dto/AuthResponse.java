package com.boilerplate.backend.modules.auth.presentation.dto;

public record AuthResponse(String token, String username, String email) {
}
