package com.boilerplate.backend.modules.role;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.boilerplate.backend.modules.role.domain.Permission;
import com.boilerplate.backend.modules.role.domain.Role;
import com.boilerplate.backend.modules.role.infrastructure.persistence.PermissionRepository;
import com.boilerplate.backend.modules.role.infrastructure.persistence.RoleRepository;
import com.boilerplate.backend.support.AbstractPostgresIntegrationTest;
import com.boilerplate.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class RoleIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "secret1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private RoleRepository roleRepository;

    @Autowired
    private PermissionRepository permissionRepository;

    private String guestToken;
    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.ensureUser("guest", PASSWORD, Role.GUEST_ID);
        testUserFactory.ensureUser("root", PASSWORD, Role.ADMIN_ID);
        guestToken = login("guest");
        adminToken = login("root");
    }

    @Test
    void seededRolesAreListedWithPermissions() throws Exception {
        mockMvc.perform(get("/api/roles").header("Authorization", "Bearer " + guestToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[0].name").value("User"))
                .andExpect(jsonPath("$[0].permissions.length()").value(0))
                .andExpect(jsonPath("$[1].name").value("Guest"))
                .andExpect(jsonPath("$[2].id").value(99))
                .andExpect(jsonPath("$[2].description").value("Administrator"))
                .andExpect(jsonPath("$[2].permissions[0].name").value("Manage Users"))
                .andExpect(jsonPath("$[2].permissions[1].name").value("Manage Roles"));
    }

    @Test
    void permissionsOfUnknownRoleAreNotFound() throws Exception {
        mockMvc.perform(get("/api/roles/99/permissions").header("Authorization", "Bearer " + guestToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/roles/5/permissions").header("Authorization", "Bearer " + guestToken))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ROLE_NOT_FOUND"));
    }

    @Test
    void onlyAdministratorsMayDeleteRoles() throws Exception {
        mockMvc.perform(delete("/api/roles/1").header("Authorization", "Bearer " + guestToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));

        assertThat(roleRepository.existsById(1)).isTrue();
    }

    @Test
    void assignedRoleCannotBeDeleted() throws Exception {
        mockMvc.perform(delete("/api/roles/2").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ROLE_IN_USE"));

        assertThat(roleRepository.existsById(2)).isTrue();
    }

    @Test
    void deletingRoleRemovesItsPermissions() throws Exception {
        Permission permission = new Permission();
        permission.setRoleId(Role.USER_ID);
        permission.setName("Read Reports");
        permission.setCreatedAt(OffsetDateTime.of(2025, 2, 1, 0, 0, 0, 0, ZoneOffset.UTC));
        permissionRepository.save(permission);

        mockMvc.perform(delete("/api/roles/1").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isNoContent());

        assertThat(roleRepository.existsById(1)).isFalse();
        assertThat(permissionRepository.findByRoleIdOrderByIdAsc(Role.USER_ID)).isEmpty();
        mockMvc.perform(delete("/api/roles/1").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isNotFound());
    }

    @Test
    void nonNumericRoleIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/roles/abc/permissions").header("Authorization", "Bearer " + guestToken))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    private String login(String username) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"usernameOrEmail\":\"" + username + "\",\"password\":\"" + PASSWORD + "\"}"))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("token").asText();
    }
}
