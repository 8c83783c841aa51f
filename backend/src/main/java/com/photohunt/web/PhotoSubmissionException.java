package com.photohunt.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class PhotoSubmissionException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public PhotoSubmissionException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public PhotoSubmissionException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }

    public static PhotoSubmissionException photoHuntNotFound(String detail) {
        return new PhotoSubmissionException(
                HttpStatus.NOT_FOUND,
                "photohunt_not_found",
                detail
        );
    }

    public static PhotoSubmissionException unreadablePhoto(String detail, Throwable cause) {
        return new PhotoSubmissionException(
                HttpStatus.BAD_REQUEST,
                "unreadable_photo",
                detail,
                cause
        );
    }

    public static PhotoSubmissionException storageFailure(String detail, Throwable cause) {
        return new PhotoSubmissionException(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "storage_failure",
                detail,
                cause
        );
    }

    public static PhotoSubmissionException validationConflict(String detail, Throwable cause) {
        return new PhotoSubmissionException(
                HttpStatus.CONFLICT,
                "validation_conflict",
                detail,
                cause
        );
    }
}
