package com.photohunt.comparator;

/**
 * Text parts of the comparison prompt. Image parts are placed between
 * {@link #INSTRUCTIONS} and {@link #responseFormat(String)}.
 */
public final class PhotoComparisonPrompt {

    public static final String INSTRUCTIONS = """
            You are an expert photo validation AI. Your task is to compare two images \
            and determine if they show the same subject or location.

            The first image is the REFERENCE image. The second image is the SUBMITTED image.

            Please analyze both images and provide a detailed comparison. Consider:
            1. Are they showing the same subject/location?
            2. Are the architectural features, landmarks, or key elements the same?
            3. Is the lighting, angle, or perspective similar enough to confirm it's the same place?
            4. Are there any obvious differences that suggest they're different locations?
            """;

    private static final String RESPONSE_FORMAT = """
            Respond in the following JSON format:
            {
                "similarity_score": 0.85,
                "confidence_score": 0.92,
                "is_valid": true,
                "notes": "The images show the same architectural landmark with similar lighting and angle.",
                "key_matches": ["Gothic architecture", "Stained glass windows"],
                "key_differences": ["Slight difference in lighting"]
            }

            similarity_score is 0.0 to 1.0 (1.0 = identical), confidence_score is your confidence \
            in the assessment from 0.0 to 1.0, and is_valid says whether the submitted photo matches \
            the reference. Be strict but fair in your assessment. The photo should clearly show the \
            same subject/location as the reference image.
            """;

    private PhotoComparisonPrompt() {
    }

    public static String responseFormat(String description) {
        return "PHOTO HUNT DESCRIPTION: " + description + "\n\n" + RESPONSE_FORMAT;
    }

    /**
     * Prompt as recorded in the validation audit trail, with the images referenced by
     * their durable locations.
     */
    public static String auditText(String referenceImage, String submittedImage, String description) {
        return INSTRUCTIONS
                + "\nREFERENCE IMAGE: " + referenceImage
                + "\nSUBMITTED IMAGE: " + submittedImage
                + "\n\n" + responseFormat(description);
    }
}
