package com.boilerplate.backend.modules.role.infrastructure.persistence;

import java.util.List;

import com.boilerplate.backend.modules.role.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, Integer> {

    List<Role> findAllByOrderByIdAsc();
}
