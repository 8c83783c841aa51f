package com.photohunt.web;

import com.photohunt.config.PhotoHuntProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/**
 * Serves images written by the local storage fallback so the absolute URLs handed to
 * the comparator resolve.
 */
@Configuration
@EnableConfigurationProperties(PhotoHuntProperties.class)
public class MediaResourceConfig implements WebMvcConfigurer {

    private final PhotoHuntProperties photoHuntProperties;

    public MediaResourceConfig(PhotoHuntProperties photoHuntProperties) {
        this.photoHuntProperties = photoHuntProperties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        PhotoHuntProperties.Media media = photoHuntProperties.media();
        String location = Path.of(media.root()).toAbsolutePath().normalize().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler(media.normalizedUrlPrefix() + "**")
                .addResourceLocations(location);
    }
}
