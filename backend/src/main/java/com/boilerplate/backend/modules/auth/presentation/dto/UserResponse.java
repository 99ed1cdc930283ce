package com.boilerplate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.boilerplate.backend.modules.auth.domain.User;
import com.fasterxml.jackson.annotation.JsonProperty;

public record UserResponse(
        Long id,
        String fullName,
        String username,
        String email,
        Integer roleId,
        @JsonProperty("isActive") boolean isActive,
        OffsetDateTime createdAt
) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getFullName(),
                user.getUsername(),
                user.getEmail(),
                user.getRoleId(),
                user.isActive(),
                user.getCreatedAt()
        );
    }
}
