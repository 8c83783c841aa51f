package com.photohunt.repository;

import com.photohunt.model.PhotoValidation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PhotoValidationRepository extends JpaRepository<PhotoValidation, UUID> {
    Optional<PhotoValidation> findByCompletionId(UUID completionId);

    long countByCompletionId(UUID completionId);
}
