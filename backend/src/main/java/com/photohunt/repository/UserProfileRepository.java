package com.photohunt.repository;

import com.photohunt.model.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.UUID;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    @Modifying
    @Query(
            value = """
                    INSERT INTO user_profiles (user_id, total_completions, created_at, updated_at)
                    VALUES (:userId, 0, :now, :now)
                    ON CONFLICT (user_id) DO NOTHING
                    """,
            nativeQuery = true
    )
    int insertIfAbsent(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("UPDATE UserProfile p " +
            "SET p.totalCompletions = p.totalCompletions + 1, p.updatedAt = :updatedAt " +
            "WHERE p.userId = :userId")
    int incrementTotalCompletions(@Param("userId") UUID userId, @Param("updatedAt") OffsetDateTime updatedAt);
}
