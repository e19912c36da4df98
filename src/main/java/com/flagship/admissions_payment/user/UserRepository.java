package com.flagship.admissions_payment.user;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, UUID> {

    /**
     * Adds an application to the user's enrolled programs.
     * A repeated insert is absorbed by the primary key.
     *
     * @return 1 if the application was added, 0 if it was already present
     */
    @Modifying
    @Query(value = """
        INSERT INTO user_enrolled_programs (user_id, application_id)
        VALUES (:userId, :applicationId)
        ON CONFLICT DO NOTHING
        """, nativeQuery = true)
    int addEnrolledProgram(@Param("userId") UUID userId, @Param("applicationId") UUID applicationId);

    @Query(value = """
        SELECT COUNT(*) FROM user_enrolled_programs
        WHERE user_id = :userId AND application_id = :applicationId
        """, nativeQuery = true)
    long countEnrollment(@Param("userId") UUID userId, @Param("applicationId") UUID applicationId);
}
