package com.photohunt.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Audit trail of the comparison behind an accepted completion. Image URLs stored here
 * are durable references, never presigned links.
 */
@Getter
@Setter
@Entity
@Table(name = "photo_validations")
public class PhotoValidation {

    @Id
    @Column(name = "validation_id", nullable = false, updatable = false)
    private UUID validationId;

    @Column(name = "completion_id", nullable = false, updatable = false, unique = true)
    private UUID completionId;

    @Column(name = "reference_image_url", nullable = false, length = 500)
    private String referenceImageUrl;

    @Column(name = "submitted_image_url", nullable = false, length = 500)
    private String submittedImageUrl;

    @Column(name = "similarity_score", nullable = false)
    private Double similarityScore;

    @Column(name = "confidence_score", nullable = false)
    private Double confidenceScore;

    @Column(name = "validation_prompt", nullable = false, columnDefinition = "TEXT")
    private String validationPrompt;

    @Column(name = "ai_response", nullable = false, columnDefinition = "TEXT")
    private String aiResponse;

    @Column(name = "is_approved", nullable = false)
    private Boolean approved = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
