package com.photohunt.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PhotoSubmissionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(PhotoSubmissionExceptionHandler.class);

    @ExceptionHandler(PhotoSubmissionException.class)
    public ResponseEntity<PhotoSubmissionErrorResponse> handle(PhotoSubmissionException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Photo submission failed with {}", ex.getCode(), ex);
        }
        return ResponseEntity
                .status(ex.getStatus())
                .body(new PhotoSubmissionErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record PhotoSubmissionErrorResponse(
            String code,
            String message
    ) {
    }
}
