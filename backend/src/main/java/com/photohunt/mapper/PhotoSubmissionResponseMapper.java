package com.photohunt.mapper;

import com.photohunt.dto.PhotoSubmissionResponses;
import com.photohunt.dto.PhotoVerdict;
import com.photohunt.model.PhotoHuntCompletion;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

@Component
public class PhotoSubmissionResponseMapper {

    static final String REMOVED_LINK = "[link removed]";

    /**
     * Matches AWS SigV4/SigV2 presigned URLs, which must not leave the service.
     */
    private static final Pattern SIGNED_URL_PATTERN = Pattern.compile(
            "https?://[^\\s\"'<>]+[?&](?:X-Amz-Signature|X-Amz-Credential|Signature|AWSAccessKeyId)=[^\\s\"'<>]*",
            Pattern.CASE_INSENSITIVE
    );

    public PhotoSubmissionResponses.CompletionSummary toCompletionSummary(PhotoHuntCompletion completion) {
        return new PhotoSubmissionResponses.CompletionSummary(
                completion.getCompletionId(),
                completion.getUserId(),
                completion.getPhotoHuntId(),
                completion.getSubmittedImage(),
                completion.getValidationScore(),
                completion.getValid(),
                scrub(completion.getValidationNotes()),
                completion.getCreatedAt()
        );
    }

    public PhotoVerdict toValidationView(PhotoVerdict verdict) {
        return new PhotoVerdict(
                verdict.similarityScore(),
                verdict.confidenceScore(),
                verdict.valid(),
                scrub(verdict.notes()),
                scrub(verdict.keyMatches()),
                scrub(verdict.keyDifferences())
        );
    }

    /**
     * Comparator text with presigned links removed, for storage alongside the validation record.
     */
    public String withoutSignedLinks(String text) {
        return scrub(text);
    }

    static String scrub(String text) {
        if (text == null) {
            return null;
        }
        return SIGNED_URL_PATTERN.matcher(text).replaceAll(REMOVED_LINK);
    }

    private static List<String> scrub(List<String> values) {
        return values.stream()
                .map(PhotoSubmissionResponseMapper::scrub)
                .toList();
    }
}
