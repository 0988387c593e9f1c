package com.williamcallahan.publist.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * JSON error payload of the publication endpoints.
 *
 * <p>Oversized pastes also carry both lengths, so a client can split the list and retry.</p>
 *
 * @param status always {@code "error"}
 * @param message user-facing error message
 * @param details exception diagnostics, absent for plain validation failures
 * @param maxInputLength configured character limit, present only for oversized input
 * @param receivedLength length of the rejected paste, present only for oversized input
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublicationErrorResponse(
        String status, String message, String details, Integer maxInputLength, Integer receivedLength) {

    static final String STATUS_ERROR = "error";

    public PublicationErrorResponse {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
        if ((maxInputLength == null) != (receivedLength == null)) {
            throw new IllegalArgumentException("Input lengths must be reported together");
        }
    }

    static PublicationErrorResponse of(String message) {
        return new PublicationErrorResponse(STATUS_ERROR, message, null, null, null);
    }

    static PublicationErrorResponse of(String message, String details) {
        return new PublicationErrorResponse(STATUS_ERROR, message, details, null, null);
    }

    static PublicationErrorResponse inputTooLarge(String message, int maxInputLength, int receivedLength) {
        return new PublicationErrorResponse(STATUS_ERROR, message, null, maxInputLength, receivedLength);
    }
}
