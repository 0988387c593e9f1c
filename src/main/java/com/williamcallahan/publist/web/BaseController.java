package com.williamcallahan.publist.web;

import com.williamcallahan.publist.service.PublicationListTooLargeException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Base controller class providing common error handling patterns.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles service exceptions with standardized error responses.
     *
     * @param e The exception that occurred
     * @param operation Description of the operation that failed
     * @return Standardized error response
     */
    protected ResponseEntity<PublicationErrorResponse> handleServiceException(Exception e, String operation) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation, e);
    }

    /**
     * Handles validation exceptions with bad request responses. Oversized pastes also report the
     * configured limit and the received length.
     *
     * @param validationException The validation exception
     * @return Bad request error response
     */
    protected ResponseEntity<PublicationErrorResponse> handleValidationException(
            IllegalArgumentException validationException) {
        if (validationException instanceof PublicationListTooLargeException tooLarge) {
            return exceptionBuilder.buildInputTooLargeResponse(tooLarge);
        }
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }
}
