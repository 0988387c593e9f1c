package com.williamcallahan.publist.domain.publication;

import java.util.Objects;

/**
 * A trimmed, non-empty line of pasted text.
 *
 * @param text trimmed line text
 * @param index 0-based position among the surviving non-empty lines
 */
public record RawLine(String text, int index) {
    public RawLine {
        Objects.requireNonNull(text, "Line text cannot be null");
        if (index < 0) {
            throw new IllegalArgumentException("Line index must be non-negative");
        }
    }
}
