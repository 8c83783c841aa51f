package com.photohunt.web;

import lombok.Getter;

/**
 * A submission field that bound but failed validation.
 */
@Getter
public class InvalidPhotoRequestException extends RuntimeException {

    private final String field;

    public InvalidPhotoRequestException(String field, String message) {
        super(message);
        this.field = field;
    }
}
