package com.photohunt.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

public final class PhotoSubmissionResponses {

    private PhotoSubmissionResponses() {
    }

    public record CompletionSummary(
            @JsonProperty("id")
            UUID completionId,
            @JsonProperty("user_id")
            UUID userId,
            @JsonProperty("photohunt_id")
            UUID photoHuntId,
            @JsonProperty("submitted_image")
            String submittedImage,
            @JsonProperty("validation_score")
            Double validationScore,
            @JsonProperty("is_valid")
            Boolean valid,
            @JsonProperty("validation_notes")
            String validationNotes,
            @JsonProperty("created_at")
            OffsetDateTime createdAt
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SubmissionResult(
            @JsonIgnore
            SubmissionOutcome outcome,
            @JsonProperty("completion")
            CompletionSummary completion,
            @JsonProperty("validation")
            PhotoVerdict validation
    ) {
        public SubmissionResult {
            Objects.requireNonNull(outcome, "outcome is required");
            Objects.requireNonNull(validation, "validation is required");
            if ((outcome == SubmissionOutcome.ACCEPTED) != (completion != null)) {
                throw new IllegalArgumentException("Only accepted submissions carry a completion");
            }
        }

        public static SubmissionResult rejected(PhotoVerdict validation) {
            return new SubmissionResult(SubmissionOutcome.REJECTED, null, validation);
        }

        public static SubmissionResult accepted(CompletionSummary completion, PhotoVerdict validation) {
            return new SubmissionResult(SubmissionOutcome.ACCEPTED, completion, validation);
        }
    }
}
