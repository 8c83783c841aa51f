package com.photohunt.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component("comparator")
public class ComparatorHealthIndicator implements HealthIndicator {

    private final PhotoHuntProperties photoHuntProperties;

    public ComparatorHealthIndicator(PhotoHuntProperties photoHuntProperties) {
        this.photoHuntProperties = photoHuntProperties;
    }

    @Override
    public Health health() {
        PhotoHuntProperties.Comparator comparator = photoHuntProperties.comparator();
        if (comparator.mock()) {
            return Health.up()
                    .withDetail("mode", "mock")
                    .build();
        }

        Health.Builder builder = StringUtils.hasText(comparator.apiKey()) ? Health.up() : Health.down();
        return builder
                .withDetail("mode", "live")
                .withDetail("model", comparator.model())
                .withDetail("baseUrl", comparator.baseUrl())
                .withDetail("apiKeyConfigured", StringUtils.hasText(comparator.apiKey()))
                .build();
    }
}
