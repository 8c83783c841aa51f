package com.photohunt.comparator;

/**
 * Provider abstraction for image comparison.
 */
public interface PhotoComparatorClient {

    /**
     * Performs one synchronous comparison and returns the model's raw text.
     *
     * @throws PhotoComparatorException on network, auth, timeout or protocol failure
     */
    String compare(PhotoComparisonRequest request);
}
