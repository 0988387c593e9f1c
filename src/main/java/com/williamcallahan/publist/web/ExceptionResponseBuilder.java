package com.williamcallahan.publist.web;

import com.williamcallahan.publist.service.PublicationListTooLargeException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Centralized utility for building consistent error responses across controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @return ResponseEntity with error details
     */
    public ResponseEntity<PublicationErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(PublicationErrorResponse.of(message));
    }

    /**
     * Builds a standardized error response with status, message, and exception details.
     *
     * @param status The HTTP status code
     * @param message The error message
     * @param exception The exception that occurred
     * @return ResponseEntity with error details
     */
    public ResponseEntity<PublicationErrorResponse> buildErrorResponse(
            HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(PublicationErrorResponse.of(message, describeException(exception)));
    }

    /**
     * Builds a bad request response for an oversized paste, reporting the limit and the received length.
     *
     * @param exception rejected input
     * @return 400 response carrying both lengths
     */
    public ResponseEntity<PublicationErrorResponse> buildInputTooLargeResponse(
            PublicationListTooLargeException exception) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(PublicationErrorResponse.inputTooLarge(
                exception.getMessage(), exception.maxInputLength(), exception.receivedLength()));
    }

    /**
     * Describes an exception and its root cause for client diagnostics.
     *
     * @param exception exception to describe
     * @return formatted exception details or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder details = new StringBuilder(exception.getClass().getSimpleName());
        if (exception.getMessage() != null) {
            details.append(": ").append(exception.getMessage());
        }
        Throwable rootCause = exception;
        while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
            rootCause = rootCause.getCause();
        }
        if (rootCause != exception) {
            details.append(" (cause=").append(rootCause.getClass().getSimpleName());
            if (rootCause.getMessage() != null) {
                details.append(": ").append(rootCause.getMessage());
            }
            details.append(')');
        }
        return details.toString();
    }
}
