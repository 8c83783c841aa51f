package com.photohunt.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Completion counter for one user. Timestamps are absent until the user's first approved submission.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserProfileResponse(
        @JsonProperty("user_id")
        UUID userId,
        @JsonProperty("total_completions")
        int totalCompletions,
        @JsonProperty("created_at")
        OffsetDateTime createdAt,
        @JsonProperty("updated_at")
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse empty(UUID userId) {
        return new UserProfileResponse(userId, 0, null, null);
    }
}
