package com.photohunt.comparator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.photohunt.config.PhotoHuntProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Base64;

/**
 * Live comparator speaking the OpenAI-compatible chat-completions contract with
 * multimodal {@code image_url} parts. One call per comparison, no retry.
 */
@Component
public class OpenAiPhotoComparatorClient implements PhotoComparatorClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiPhotoComparatorClient.class);
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final WebClient comparatorWebClient;
    private final PhotoHuntProperties.Comparator comparator;

    public OpenAiPhotoComparatorClient(WebClient comparatorWebClient, PhotoHuntProperties photoHuntProperties) {
        this.comparatorWebClient = comparatorWebClient;
        this.comparator = photoHuntProperties.comparator();
    }

    @Override
    public String compare(PhotoComparisonRequest request) {
        ObjectNode body = buildRequestBody(request);
        Duration timeout = Duration.ofSeconds(comparator.timeoutSeconds());

        JsonNode response;
        try {
            response = comparatorWebClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException ex) {
            throw new PhotoComparatorException(
                    "Comparator returned HTTP " + ex.getStatusCode().value() + " for model " + request.model(),
                    ex
            );
        } catch (RuntimeException ex) {
            throw new PhotoComparatorException("Comparator call failed: " + ex.getMessage(), ex);
        }

        String content = extractContent(response);
        log.debug("Comparator model {} returned {} characters", request.model(), content.length());
        return content;
    }

    ObjectNode buildRequestBody(PhotoComparisonRequest request) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("model", request.model());
        root.put("temperature", comparator.temperature());

        ArrayNode messages = root.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");

        ArrayNode content = message.putArray("content");
        addText(content, PhotoComparisonPrompt.INSTRUCTIONS);
        addImage(content, request.referenceImageUrl());
        addImage(content, submittedImageReference(request));
        addText(content, PhotoComparisonPrompt.responseFormat(request.description()));
        return root;
    }

    private static String submittedImageReference(PhotoComparisonRequest request) {
        if (!request.inlineSubmission()) {
            return request.submittedImageUrl();
        }
        return "data:"
                + request.submittedMediaType()
                + ";base64,"
                + Base64.getEncoder().encodeToString(request.submittedImageBytes());
    }

    private static void addText(ArrayNode content, String text) {
        ObjectNode part = content.addObject();
        part.put("type", "text");
        part.put("text", text);
    }

    private static void addImage(ArrayNode content, String url) {
        ObjectNode part = content.addObject();
        part.put("type", "image_url");
        part.putObject("image_url").put("url", url);
    }

    private static String extractContent(JsonNode response) {
        JsonNode contentNode = response == null
                ? null
                : response.path("choices").path(0).path("message").path("content");
        if (contentNode == null || contentNode.isMissingNode() || contentNode.isNull()) {
            throw new PhotoComparatorException("Comparator response missing message content");
        }
        if (contentNode.isTextual()) {
            return contentNode.textValue();
        }
        if (contentNode.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode part : contentNode) {
                if (part.path("text").isTextual()) {
                    text.append(part.path("text").textValue());
                }
            }
            return text.toString();
        }
        throw new PhotoComparatorException("Comparator message content has unexpected type " + contentNode.getNodeType());
    }
}
