package com.photohunt.dto;

import org.springframework.http.HttpStatus;

/**
 * Terminal state of a submission and the HTTP status its response carries.
 */
public enum SubmissionOutcome {
    REJECTED(HttpStatus.OK),
    ACCEPTED(HttpStatus.CREATED);

    private final HttpStatus httpStatus;

    SubmissionOutcome(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}
