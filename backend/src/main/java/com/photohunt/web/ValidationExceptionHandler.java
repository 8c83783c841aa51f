package com.photohunt.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

/**
 * Renders request binding failures as field errors.
 */
@RestControllerAdvice
public class ValidationExceptionHandler {

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ValidationErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
        return fieldError(ex.getRequestPartName(), "This field is required.");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ValidationErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return fieldError(ex.getParameterName(), "This field is required.");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ValidationErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return fieldError(ex.getHeaderName(), "This header is required.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ValidationErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return fieldError(ex.getName(), "Must be a valid UUID.");
    }

    @ExceptionHandler(InvalidPhotoRequestException.class)
    public ResponseEntity<ValidationErrorResponse> handleInvalidRequest(InvalidPhotoRequestException ex) {
        return fieldError(ex.getField(), ex.getMessage());
    }

    private static ResponseEntity<ValidationErrorResponse> fieldError(String field, String message) {
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse("Validation failed: " + message, Map.of(field, message)));
    }

    public record ValidationErrorResponse(
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
