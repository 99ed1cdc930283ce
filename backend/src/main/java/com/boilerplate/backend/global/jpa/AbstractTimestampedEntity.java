package com.boilerplate.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.MappedSuperclass;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Base for rows whose timestamps are filled by JPA auditing from the shared UTC clock
 * ({@code JpaConfig#utcOffsetDateTimeProvider}). Both columns are {@code TIMESTAMPTZ} and always
 * carry offset {@code Z}.
 *
 * <p>{@code createdAt} is set once on insert and surfaces in API responses such as the user
 * profile. {@code updatedAt} is null for a row that was never changed after registration.
 */
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class AbstractTimestampedEntity {

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    /**
     * Time of the last update, null until the row is first modified.
     */
    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
