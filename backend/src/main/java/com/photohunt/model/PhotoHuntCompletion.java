package com.photohunt.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One user's outcome for one photo hunt. Overwritten in place on accepted resubmission.
 */
@Getter
@Setter
@Entity
@Table(
        name = "photohunt_completions",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_photohunt_completions_user_photohunt",
                columnNames = {"user_id", "photohunt_id"}
        )
)
public class PhotoHuntCompletion {

    @Id
    @Column(name = "completion_id", nullable = false, updatable = false)
    private UUID completionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "photohunt_id", nullable = false, updatable = false)
    private UUID photoHuntId;

    @Column(name = "submitted_image", nullable = false, length = 500)
    private String submittedImage;

    @Column(name = "validation_score")
    private Double validationScore;

    @Column(name = "is_valid", nullable = false)
    private Boolean valid = false;

    @Column(name = "validation_notes", columnDefinition = "TEXT")
    private String validationNotes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
