package com.photohunt.repository;

import com.photohunt.model.PhotoHuntCompletion;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PhotoHuntCompletionRepository extends JpaRepository<PhotoHuntCompletion, UUID> {
    Optional<PhotoHuntCompletion> findByUserIdAndPhotoHuntId(UUID userId, UUID photoHuntId);

    long countByUserIdAndPhotoHuntId(UUID userId, UUID photoHuntId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from PhotoHuntCompletion c where c.userId = :userId and c.photoHuntId = :photoHuntId")
    Optional<PhotoHuntCompletion> findByUserIdAndPhotoHuntIdForUpdate(
            @Param("userId") UUID userId,
            @Param("photoHuntId") UUID photoHuntId
    );
}
