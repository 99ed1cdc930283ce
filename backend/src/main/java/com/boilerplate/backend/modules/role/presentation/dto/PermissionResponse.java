package com.boilerplate.backend.modules.role.presentation.dto;

import java.time.OffsetDateTime;

import com.boilerplate.backend.modules.role.domain.Permission;

public record PermissionResponse(
        Long id,
        Integer roleId,
        String name,
        String description,
        OffsetDateTime createdAt
) {

    public static PermissionResponse from(Permission permission) {
        return new PermissionResponse(
                permission.getId(),
                permission.getRoleId(),
                permission.getName(),
                permission.getDescription(),
                permission.getCreatedAt()
        );
    }
}
