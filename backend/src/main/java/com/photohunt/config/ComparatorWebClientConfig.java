package com.photohunt.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient bound to the vision model's OpenAI-compatible endpoint.
 */
@Configuration
public class ComparatorWebClientConfig {

    private static final int MAX_RESPONSE_BYTES = 2 * 1024 * 1024;

    @Bean
    public WebClient comparatorWebClient(WebClient.Builder webClientBuilder, PhotoHuntProperties photoHuntProperties) {
        PhotoHuntProperties.Comparator comparator = photoHuntProperties.comparator();
        WebClient.Builder builder = webClientBuilder
                .baseUrl(comparator.baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES));
        if (StringUtils.hasText(comparator.apiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + comparator.apiKey().trim());
        }
        return builder.build();
    }
}
