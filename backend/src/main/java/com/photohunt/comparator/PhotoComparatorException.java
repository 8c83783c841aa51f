package com.photohunt.comparator;

public class PhotoComparatorException extends RuntimeException {

    public PhotoComparatorException(String message) {
        super(message);
    }

    public PhotoComparatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
