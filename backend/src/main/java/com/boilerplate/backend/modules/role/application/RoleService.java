package com.boilerplate.backend.modules.role.application;

import java.util.List;

import com.boilerplate.backend.global.error.ProblemException;
import com.boilerplate.backend.modules.auth.domain.User;
import com.boilerplate.backend.modules.auth.infrastructure.persistence.UserRepository;
import com.boilerplate.backend.modules.role.domain.Role;
import com.boilerplate.backend.modules.role.infrastructure.persistence.PermissionRepository;
import com.boilerplate.backend.modules.role.infrastructure.persistence.RoleRepository;
import com.boilerplate.backend.modules.role.presentation.dto.PermissionResponse;
import com.boilerplate.backend.modules.role.presentation.dto.RoleResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class RoleService {

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final UserRepository userRepository;

    public RoleService(
            RoleRepository roleRepository,
            PermissionRepository permissionRepository,
            UserRepository userRepository
    ) {
        this.roleRepository = roleRepository;
        this.permissionRepository = permissionRepository;
        this.userRepository = userRepository;
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles() {
        return roleRepository.findAllByOrderByIdAsc().stream()
                .map(role -> toResponse(role, permissionsOf(role.getId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PermissionResponse> listPermissions(Integer roleId) {
        Role role = loadRole(roleId);
        return permissionsOf(role.getId());
    }

    /**
     * Removes a role together with its permissions. Users keep a hard reference to their role,
     * so a role that is still assigned is refused.
     */
    public void deleteRole(Long actorUserId, Integer roleId) {
        User actor = userRepository.findById(actorUserId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Token does not identify a user"));
        if (actor.getRoleId() == null || actor.getRoleId() != Role.ADMIN_ID) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "FORBIDDEN", "Administrator role required");
        }

        Role role = loadRole(roleId);
        if (userRepository.existsByRoleId(role.getId())) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROLE_IN_USE", "Role is still assigned to users");
        }

        int removedPermissions = permissionRepository.deleteByRoleId(role.getId());
        roleRepository.delete(role);
        log.info("Role id={} name={} deleted by user id={} (permissions removed={})",
                role.getId(), role.getName(), actorUserId, removedPermissions);
    }

    private Role loadRole(Integer roleId) {
        return roleRepository.findById(roleId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ROLE_NOT_FOUND", "Role not found"));
    }

    private List<PermissionResponse> permissionsOf(Integer roleId) {
        return permissionRepository.findByRoleIdOrderByIdAsc(roleId).stream()
                .map(PermissionResponse::from)
                .toList();
    }

    private RoleResponse toResponse(Role role, List<PermissionResponse> permissions) {
        return new RoleResponse(role.getId(), role.getName(), role.getDescription(), role.getCreatedAt(), permissions);
    }
}
