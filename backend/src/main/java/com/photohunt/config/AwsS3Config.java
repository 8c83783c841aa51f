package com.photohunt.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * Builds the S3 client and presigner from the storage settings.
 */
@Configuration
public class AwsS3Config {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(PhotoHuntProperties photoHuntProperties) {
        PhotoHuntProperties.Storage storage = photoHuntProperties.storage();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(storage.region()))
                .credentialsProvider(credentialsProvider(storage))
                .serviceConfiguration(serviceConfiguration(storage));
        if (StringUtils.hasText(storage.endpoint())) {
            builder.endpointOverride(URI.create(storage.endpoint().trim()));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner(PhotoHuntProperties photoHuntProperties) {
        return buildPresigner(photoHuntProperties.storage());
    }

    public static S3Presigner buildPresigner(PhotoHuntProperties.Storage storage) {
        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(storage.region()))
                .credentialsProvider(credentialsProvider(storage))
                .serviceConfiguration(serviceConfiguration(storage));
        if (StringUtils.hasText(storage.endpoint())) {
            builder.endpointOverride(URI.create(storage.endpoint().trim()));
        }
        return builder.build();
    }

    private static AwsCredentialsProvider credentialsProvider(PhotoHuntProperties.Storage storage) {
        if (storage.hasStaticCredentials()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(storage.accessKeyId().trim(), storage.secretAccessKey().trim())
            );
        }
        return DefaultCredentialsProvider.create();
    }

    private static S3Configuration serviceConfiguration(PhotoHuntProperties.Storage storage) {
        return S3Configuration.builder()
                .pathStyleAccessEnabled(storage.pathStyleAccess())
                .build();
    }
}
