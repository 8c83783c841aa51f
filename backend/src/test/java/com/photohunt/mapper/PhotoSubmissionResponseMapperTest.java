package com.photohunt.mapper;

import com.photohunt.dto.PhotoSubmissionResponses;
import com.photohunt.dto.PhotoVerdict;
import com.photohunt.model.PhotoHuntCompletion;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhotoSubmissionResponseMapperTest {

    private static final String SIGNED_URL = "https://photos-bucket.s3.amazonaws.com/submissions/a.jpg"
            + "?X-Amz-Algorithm=AWS4-HMAC-SHA256&X-Amz-Credential=AKID%2F20260101&X-Amz-Signature=abc123";

    private final PhotoSubmissionResponseMapper mapper = new PhotoSubmissionResponseMapper();

    @Test
    void toValidationViewRemovesSignedUrlsFromNotesAndKeyLists() {
        PhotoVerdict verdict = new PhotoVerdict(
                0.8,
                0.9,
                true,
                "Compared against " + SIGNED_URL + " successfully",
                List.of("tower in " + SIGNED_URL),
                List.of("no links here")
        );

        PhotoVerdict view = mapper.toValidationView(verdict);

        assertEquals("Compared against [link removed] successfully", view.notes());
        assertEquals(List.of("tower in [link removed]"), view.keyMatches());
        assertEquals(List.of("no links here"), view.keyDifferences());
        assertEquals(0.8, view.similarityScore());
        assertTrue(view.valid());
    }

    @Test
    void scrubLeavesDurableUrlsAlone() {
        String durable = "see https://photos-bucket.s3.us-east-1.amazonaws.com/submissions/a.jpg";

        assertEquals(durable, PhotoSubmissionResponseMapper.scrub(durable));
        assertNull(PhotoSubmissionResponseMapper.scrub(null));
        assertEquals(
                "legacy [link removed] end",
                PhotoSubmissionResponseMapper.scrub(
                        "legacy https://b.s3.amazonaws.com/k.jpg?AWSAccessKeyId=AK&Expires=1&Signature=x end"
                )
        );
    }

    @Test
    void toCompletionSummaryCopiesCompletionFields() {
        PhotoHuntCompletion completion = new PhotoHuntCompletion();
        completion.setCompletionId(UUID.fromString("00000000-0000-0000-0000-000000000101"));
        completion.setUserId(UUID.fromString("00000000-0000-0000-0000-000000000102"));
        completion.setPhotoHuntId(UUID.fromString("00000000-0000-0000-0000-000000000103"));
        completion.setSubmittedImage("https://photos-bucket.s3.us-east-1.amazonaws.com/submissions/a.jpg");
        completion.setValidationScore(0.81);
        completion.setValid(true);
        completion.setValidationNotes("same fountain " + SIGNED_URL);
        completion.setCreatedAt(OffsetDateTime.parse("2026-03-01T10:15:30Z"));

        PhotoSubmissionResponses.CompletionSummary summary = mapper.toCompletionSummary(completion);

        assertEquals(completion.getCompletionId(), summary.completionId());
        assertEquals(completion.getUserId(), summary.userId());
        assertEquals(completion.getPhotoHuntId(), summary.photoHuntId());
        assertEquals(completion.getSubmittedImage(), summary.submittedImage());
        assertEquals(0.81, summary.validationScore());
        assertTrue(summary.valid());
        assertEquals("same fountain [link removed]", summary.validationNotes());
        assertFalse(summary.validationNotes().contains("X-Amz"));
        assertEquals(completion.getCreatedAt(), summary.createdAt());
    }
}
