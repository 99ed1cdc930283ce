package com.boilerplate.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
