package com.photohunt.comparator;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Deterministic comparator used for local runs and tests. Scores are derived from the
 * request, never from image content, and always clear the approval threshold.
 */
@Component
public class MockPhotoComparatorClient implements PhotoComparatorClient {

    private static final double APPROVAL_THRESHOLD = 0.7;

    @Override
    public String compare(PhotoComparisonRequest request) {
        String seed = seed(request);
        double similarity = APPROVAL_THRESHOLD + stableIndex(seed + "|similarity", 26) / 100.0;
        double confidence = 0.75 + stableIndex(seed + "|confidence", 21) / 100.0;

        return "Mock comparator assessment follows.\n"
                + "{"
                + "\"similarity_score\": " + format(similarity) + ", "
                + "\"confidence_score\": " + format(confidence) + ", "
                + "\"is_valid\": " + (similarity >= APPROVAL_THRESHOLD) + ", "
                + "\"notes\": \"Mock comparator scored the submission deterministically.\", "
                + "\"key_matches\": [\"mock subject\"], "
                + "\"key_differences\": []"
                + "}";
    }

    private static String seed(PhotoComparisonRequest request) {
        String submitted = request.inlineSubmission()
                ? "inline:" + request.submittedImageBytes().length
                : withoutQuery(request.submittedImageUrl());
        return withoutQuery(request.referenceImageUrl()) + "|" + submitted + "|" + request.description();
    }

    // Presigned query strings change on every call.
    private static String withoutQuery(String url) {
        try {
            URI uri = URI.create(url);
            return uri.getQuery() == null ? url : url.substring(0, url.indexOf('?'));
        } catch (IllegalArgumentException ex) {
            return url;
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static int stableIndex(String seed, int bound) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(seed.getBytes(StandardCharsets.UTF_8));
            int raw = ByteBuffer.wrap(hash).getInt();
            return Math.floorMod(raw, bound);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 digest algorithm is required", ex);
        }
    }
}
