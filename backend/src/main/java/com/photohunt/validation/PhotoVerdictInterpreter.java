package com.photohunt.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.photohunt.dto.PhotoVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw comparator text into a {@link PhotoVerdict}. Tries the first brace-delimited
 * JSON span, then keyword and number heuristics, and falls back to
 * {@link PhotoVerdict#fallback()}. Never throws.
 */
public final class PhotoVerdictInterpreter {

    private static final Logger log = LoggerFactory.getLogger(PhotoVerdictInterpreter.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final String FIELD_SIMILARITY_SCORE = "similarity_score";
    private static final String FIELD_CONFIDENCE_SCORE = "confidence_score";
    private static final String FIELD_IS_VALID = "is_valid";
    private static final String FIELD_NOTES = "notes";
    private static final String FIELD_KEY_MATCHES = "key_matches";
    private static final String FIELD_KEY_DIFFERENCES = "key_differences";

    private static final String DEFAULT_NOTES = "AI validation completed";

    private static final Pattern SIMILARITY_PATTERN =
            Pattern.compile("similarity(?:[ _]score)?[\"']?[:=\\s]+(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONFIDENCE_PATTERN =
            Pattern.compile("confidence(?:[ _]score)?[\"']?[:=\\s]+(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

    private static final double DEFAULT_TEXT_SCORE = 0.5;

    private static final List<String> APPROVAL_KEYWORDS = List.of("valid", "match", "same", "correct");
    private static final List<String> REJECTION_KEYWORDS = List.of("invalid", "different", "not match", "incorrect");

    private PhotoVerdictInterpreter() {
    }

    public static PhotoVerdict interpret(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            log.warn("Comparator returned no text; using fallback verdict");
            return PhotoVerdict.fallback();
        }
        try {
            PhotoVerdict fromJson = fromJsonSpan(rawText);
            if (fromJson != null) {
                return fromJson;
            }
            PhotoVerdict fromText = fromText(rawText);
            if (fromText != null) {
                return fromText;
            }
            log.warn("Comparator response carried no JSON, scores or verdict wording; using fallback verdict");
        } catch (RuntimeException ex) {
            log.warn("Comparator response could not be interpreted; using fallback verdict", ex);
        }
        return PhotoVerdict.fallback();
    }

    private static PhotoVerdict fromJsonSpan(String rawText) {
        int start = rawText.indexOf('{');
        int end = rawText.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(rawText.substring(start, end + 1));
        } catch (JsonProcessingException ex) {
            log.debug("Comparator JSON span did not parse: {}", ex.getOriginalMessage());
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }

        return new PhotoVerdict(
                normalizeScore(root.path(FIELD_SIMILARITY_SCORE).asDouble(0.0)),
                normalizeScore(root.path(FIELD_CONFIDENCE_SCORE).asDouble(0.0)),
                root.path(FIELD_IS_VALID).asBoolean(false),
                root.hasNonNull(FIELD_NOTES) ? root.get(FIELD_NOTES).asText() : DEFAULT_NOTES,
                textList(root.get(FIELD_KEY_MATCHES)),
                textList(root.get(FIELD_KEY_DIFFERENCES))
        );
    }

    private static PhotoVerdict fromText(String rawText) {
        Double similarity = findScore(SIMILARITY_PATTERN, rawText);
        Double confidence = findScore(CONFIDENCE_PATTERN, rawText);
        Boolean validity = readValidity(rawText);
        if (similarity == null && confidence == null && validity == null) {
            return null;
        }

        return new PhotoVerdict(
                similarity == null ? DEFAULT_TEXT_SCORE : similarity,
                confidence == null ? DEFAULT_TEXT_SCORE : confidence,
                Boolean.TRUE.equals(validity),
                rawText,
                List.of(),
                List.of()
        );
    }

    private static Double findScore(Pattern pattern, String rawText) {
        Matcher matcher = pattern.matcher(rawText);
        if (!matcher.find()) {
            return null;
        }
        return normalizeScore(Double.parseDouble(matcher.group(1)));
    }

    // Null when the text carries no verdict wording at all.
    private static Boolean readValidity(String rawText) {
        String lower = rawText.toLowerCase(Locale.ROOT);
        for (String keyword : APPROVAL_KEYWORDS) {
            if (lower.contains(keyword)) {
                return Boolean.TRUE;
            }
        }
        for (String keyword : REJECTION_KEYWORDS) {
            if (lower.contains(keyword)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    // Values above 1.0 are percentages.
    private static double normalizeScore(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        double normalized = value > 1.0 ? value / 100.0 : value;
        return Math.min(1.0, normalized);
    }

    private static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isNull()) {
                values.add(element.asText());
            }
        }
        return values;
    }
}
