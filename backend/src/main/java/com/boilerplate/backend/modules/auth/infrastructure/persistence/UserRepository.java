package com.boilerplate.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.boilerplate.backend.modules.auth.domain.User;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRepository extends JpaRepository<User, Long> {

    @Query("select u from User u where lower(u.username) = lower(:username)")
    Optional<User> findByUsernameIgnoreCase(@Param("username") String username);

    @Query("select u from User u where lower(u.email) = lower(:email)")
    Optional<User> findByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select case when count(u) > 0 then true else false end
              from User u
             where lower(u.username) = lower(:username)
                or lower(u.email) = lower(:email)
            """)
    boolean existsByUsernameOrEmail(@Param("username") String username, @Param("email") String email);

    boolean existsByRoleId(Integer roleId);
}
