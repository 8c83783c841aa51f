package com.photohunt.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

/**
 * Photo hunt settings, bound once at startup and passed to each component by constructor.
 */
@Validated
@ConfigurationProperties(prefix = "photohunt")
public record PhotoHuntProperties(
        @Valid @DefaultValue Storage storage,
        @Valid @DefaultValue Comparator comparator,
        @Valid @DefaultValue Media media
) {

    /**
     * Object store used for submitted and reference images.
     */
    public record Storage(
            String bucket,
            @NotBlank @DefaultValue("us-east-1") String region,
            String accessKeyId,
            String secretAccessKey,
            @DefaultValue("public-read") String defaultAcl,
            String customDomain,
            String endpoint,
            @DefaultValue("false") boolean pathStyleAccess,
            @Positive @DefaultValue("900") int presignTtlSeconds
    ) {

        /**
         * Host that public object URLs are written against.
         */
        public String resolvedDomain() {
            if (StringUtils.hasText(customDomain)) {
                return customDomain.trim();
            }
            return bucket + ".s3." + region + ".amazonaws.com";
        }

        public boolean hasStaticCredentials() {
            return StringUtils.hasText(accessKeyId) && StringUtils.hasText(secretAccessKey);
        }
    }

    /**
     * Vision model consulted to compare a submission with the reference image.
     */
    public record Comparator(
            @DefaultValue("true") boolean mock,
            String apiKey,
            @NotBlank @DefaultValue("gpt-4o") String model,
            @NotBlank @DefaultValue("https://api.openai.com/v1") String baseUrl,
            @PositiveOrZero @DefaultValue("0.1") double temperature,
            @Positive @DefaultValue("30") int timeoutSeconds
    ) {
    }

    /**
     * Local disk fallback for images the object store refused.
     */
    public record Media(
            @NotBlank @DefaultValue("media") String root,
            @NotBlank @DefaultValue("/media/") String urlPrefix,
            @DefaultValue("http://localhost:8080") String publicBaseUrl
    ) {

        /**
         * URL prefix normalized to start and end with a slash.
         */
        public String normalizedUrlPrefix() {
            String prefix = StringUtils.hasText(urlPrefix) ? urlPrefix.trim() : "/media/";
            if (!prefix.startsWith("/")) {
                prefix = "/" + prefix;
            }
            if (!prefix.endsWith("/")) {
                prefix = prefix + "/";
            }
            return prefix;
        }
    }
}
