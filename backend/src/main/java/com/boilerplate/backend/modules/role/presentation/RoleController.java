package com.boilerplate.backend.modules.role.presentation;

import java.util.List;

import com.boilerplate.backend.global.security.RequestIdentity;
import com.boilerplate.backend.global.security.SecurityUtils;
import com.boilerplate.backend.modules.role.application.RoleService;
import com.boilerplate.backend.modules.role.presentation.dto.PermissionResponse;
import com.boilerplate.backend.modules.role.presentation.dto.RoleResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/roles")
public class RoleController {

    private final RoleService roleService;

    public RoleController(RoleService roleService) {
        this.roleService = roleService;
    }

    @Operation(summary = "List roles with their permissions")
    @GetMapping
    public ResponseEntity<List<RoleResponse>> listRoles() {
        return ResponseEntity.ok(roleService.listRoles());
    }

    @Operation(summary = "List permissions granted to a role")
    @GetMapping("/{roleId}/permissions")
    public ResponseEntity<List<PermissionResponse>> listPermissions(@PathVariable Integer roleId) {
        return ResponseEntity.ok(roleService.listPermissions(roleId));
    }

    @Operation(summary = "Delete an unassigned role and its permissions (administrators only)")
    @DeleteMapping("/{roleId}")
    public ResponseEntity<Void> deleteRole(
            @AuthenticationPrincipal RequestIdentity identity,
            @PathVariable Integer roleId
    ) {
        roleService.deleteRole(SecurityUtils.requireUserId(identity), roleId);
        return ResponseEntity.noContent().build();
    }
}
