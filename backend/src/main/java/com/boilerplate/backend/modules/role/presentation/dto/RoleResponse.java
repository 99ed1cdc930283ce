package com.boilerplate.backend.modules.role.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record RoleResponse(
        Integer id,
        String name,
        String description,
        OffsetDateTime createdAt,
        List<PermissionResponse> permissions
) {
}
