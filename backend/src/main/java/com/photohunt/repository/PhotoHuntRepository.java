package com.photohunt.repository;

import com.photohunt.model.PhotoHunt;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PhotoHuntRepository extends JpaRepository<PhotoHunt, UUID> {
    Optional<PhotoHunt> findByPhotoHuntIdAndActiveTrue(UUID photoHuntId);

    boolean existsByPhotoHuntIdAndActiveTrue(UUID photoHuntId);
}
