package com.photohunt.comparator;

import com.photohunt.config.PhotoHuntProperties;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves comparator selection and model, then executes one comparison.
 */
@Service
public class PhotoComparatorGateway {

    private final PhotoHuntProperties.Comparator comparator;
    private final MockPhotoComparatorClient mockPhotoComparatorClient;
    private final OpenAiPhotoComparatorClient openAiPhotoComparatorClient;

    public PhotoComparatorGateway(
            PhotoHuntProperties photoHuntProperties,
            MockPhotoComparatorClient mockPhotoComparatorClient,
            OpenAiPhotoComparatorClient openAiPhotoComparatorClient
    ) {
        this.comparator = photoHuntProperties.comparator();
        this.mockPhotoComparatorClient = mockPhotoComparatorClient;
        this.openAiPhotoComparatorClient = openAiPhotoComparatorClient;
    }

    public String compare(String referenceImageUrl, String submittedImageUrl, String description) {
        return client().compare(PhotoComparisonRequest.forUrl(
                referenceImageUrl,
                submittedImageUrl,
                description,
                resolveModel()
        ));
    }

    public String compare(
            String referenceImageUrl,
            byte[] submittedImageBytes,
            String submittedMediaType,
            String description
    ) {
        return client().compare(PhotoComparisonRequest.forBytes(
                referenceImageUrl,
                submittedImageBytes,
                submittedMediaType,
                description,
                resolveModel()
        ));
    }

    private PhotoComparatorClient client() {
        if (comparator.mock()) {
            return mockPhotoComparatorClient;
        }
        if (!StringUtils.hasText(comparator.apiKey())) {
            throw new PhotoComparatorException("photohunt.comparator.api-key must be set when mock mode is off");
        }
        return openAiPhotoComparatorClient;
    }

    private String resolveModel() {
        if (!StringUtils.hasText(comparator.model())) {
            throw new PhotoComparatorException("photohunt.comparator.model must not be blank");
        }
        return comparator.model().trim();
    }
}
