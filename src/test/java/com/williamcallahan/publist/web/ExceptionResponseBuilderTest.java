package com.williamcallahan.publist.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.publist.service.PublicationListTooLargeException;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Verifies error payloads and exception descriptions.
 */
class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_includesRootCause() {
        UncheckedIOException exception =
                new UncheckedIOException("Failed to read publication list", new IOException("disk gone"));

        String details = builder.describeException(exception);

        assertTrue(details.startsWith("UncheckedIOException: Failed to read publication list"), details);
        assertTrue(details.contains("cause=IOException: disk gone"), details);
    }

    @Test
    void describeException_nullException_returnsNull() {
        assertNull(builder.describeException(null));
    }

    @Test
    void buildErrorResponse_carriesStatusAndDetails() {
        ResponseEntity<PublicationErrorResponse> response = builder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to parse", new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        PublicationErrorResponse body = response.getBody();
        assertEquals("error", body.status());
        assertEquals("IllegalStateException: boom", body.details());
        assertNull(body.maxInputLength());
    }

    @Test
    void buildInputTooLargeResponse_reportsLimitAndReceivedLength() {
        ResponseEntity<PublicationErrorResponse> response =
                builder.buildInputTooLargeResponse(new PublicationListTooLargeException(850, 400));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        PublicationErrorResponse body = response.getBody();
        assertEquals(400, body.maxInputLength());
        assertEquals(850, body.receivedLength());
        assertEquals("Pasted text is 850 characters; the limit is 400.", body.message());
        assertNull(body.details());
    }
}
