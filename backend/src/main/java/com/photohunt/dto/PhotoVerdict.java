package com.photohunt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured reading of one comparator response. Never persisted as such; its fields
 * are copied onto the completion and validation records.
 */
public record PhotoVerdict(
        @JsonProperty("similarity_score")
        double similarityScore,
        @JsonProperty("confidence_score")
        double confidenceScore,
        @JsonProperty("is_valid")
        boolean valid,
        @JsonProperty("notes")
        String notes,
        @JsonProperty("key_matches")
        List<String> keyMatches,
        @JsonProperty("key_differences")
        List<String> keyDifferences
) {

    public static final String FALLBACK_NOTES = "AI validation failed - manual review required";

    public PhotoVerdict {
        notes = notes == null ? "" : notes;
        keyMatches = keyMatches == null ? List.of() : List.copyOf(keyMatches);
        keyDifferences = keyDifferences == null ? List.of() : List.copyOf(keyDifferences);
    }

    /**
     * Fail-closed verdict for responses that could not be obtained or interpreted.
     */
    public static PhotoVerdict fallback() {
        return new PhotoVerdict(0.0, 0.0, false, FALLBACK_NOTES, List.of(), List.of());
    }
}
