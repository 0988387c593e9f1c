package com.williamcallahan.publist.service;

import java.util.Locale;

/**
 * Signals that a pasted publication list exceeds the configured input limit.
 */
public final class PublicationListTooLargeException extends IllegalArgumentException {

    private static final String MESSAGE_FMT = "Pasted text is %d characters; the limit is %d.";

    private final int receivedLength;
    private final int maxInputLength;

    /**
     * Creates an exception describing the received and permitted lengths.
     */
    public PublicationListTooLargeException(int receivedLength, int maxInputLength) {
        super(String.format(Locale.ROOT, MESSAGE_FMT, receivedLength, maxInputLength));
        this.receivedLength = receivedLength;
        this.maxInputLength = maxInputLength;
    }

    public int receivedLength() {
        return receivedLength;
    }

    public int maxInputLength() {
        return maxInputLength;
    }
}
