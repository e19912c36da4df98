package com.flagship.admissions_payment.user;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * JPA Entity for an applicant account.
 *
 * enrolledPrograms holds the ids of paid applications. The collection table
 * has (user_id, application_id) as its primary key; inserts go through
 * {@link UserRepository#addEnrolledProgram} so that membership is a set
 * operation in the database rather than a read-modify-write here.
 */
@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "full_name")
    private String fullName;

    @ElementCollection
    @CollectionTable(name = "user_enrolled_programs", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "application_id", nullable = false)
    private Set<UUID> enrolledPrograms = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    public static UserEntity register(String email, String fullName) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        UserEntity entity = new UserEntity();
        entity.id = UUID.randomUUID();
        entity.email = email;
        entity.fullName = fullName;
        return entity;
    }

    public Set<UUID> getEnrolledPrograms() {
        return Collections.unmodifiableSet(enrolledPrograms);
    }
}
