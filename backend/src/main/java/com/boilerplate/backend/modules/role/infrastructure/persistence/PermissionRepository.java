package com.boilerplate.backend.modules.role.infrastructure.persistence;

import java.util.List;

import com.boilerplate.backend.modules.role.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PermissionRepository extends JpaRepository<Permission, Long> {

    List<Permission> findByRoleIdOrderByIdAsc(Integer roleId);

    @Modifying
    @Query("delete from Permission p where p.roleId = :roleId")
    int deleteByRoleId(@Param("roleId") Integer roleId);
}
