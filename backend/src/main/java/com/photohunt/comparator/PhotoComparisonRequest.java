package com.photohunt.comparator;

import org.springframework.util.StringUtils;

/**
 * Fully-resolved input for one comparison call. The submitted image is either a URL the
 * comparator can fetch or inline bytes, never both.
 */
public record PhotoComparisonRequest(
        String referenceImageUrl,
        String submittedImageUrl,
        byte[] submittedImageBytes,
        String submittedMediaType,
        String description,
        String model
) {
    public PhotoComparisonRequest {
        if (!StringUtils.hasText(referenceImageUrl)) {
            throw new IllegalArgumentException("referenceImageUrl is required");
        }
        referenceImageUrl = referenceImageUrl.trim();

        boolean hasUrl = StringUtils.hasText(submittedImageUrl);
        boolean hasBytes = submittedImageBytes != null && submittedImageBytes.length > 0;
        if (hasUrl == hasBytes) {
            throw new IllegalArgumentException("Exactly one of submittedImageUrl or submittedImageBytes is required");
        }
        if (hasBytes && !StringUtils.hasText(submittedMediaType)) {
            throw new IllegalArgumentException("submittedMediaType is required for inline image bytes");
        }

        description = description == null ? "" : description.trim();

        if (!StringUtils.hasText(model)) {
            throw new IllegalArgumentException("model is required");
        }
        model = model.trim();
    }

    public static PhotoComparisonRequest forUrl(
            String referenceImageUrl,
            String submittedImageUrl,
            String description,
            String model
    ) {
        return new PhotoComparisonRequest(referenceImageUrl, submittedImageUrl, null, null, description, model);
    }

    public static PhotoComparisonRequest forBytes(
            String referenceImageUrl,
            byte[] submittedImageBytes,
            String submittedMediaType,
            String description,
            String model
    ) {
        return new PhotoComparisonRequest(
                referenceImageUrl,
                null,
                submittedImageBytes,
                submittedMediaType,
                description,
                model
        );
    }

    public boolean inlineSubmission() {
        return submittedImageBytes != null;
    }
}
