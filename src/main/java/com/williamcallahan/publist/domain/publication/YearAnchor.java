package com.williamcallahan.publist.domain.publication;

/**
 * The line holding one record's publication year.
 *
 * @param lineIndex index of the anchor line among normalized lines
 * @param year publication year found on that line
 */
public record YearAnchor(int lineIndex, int year) {
    public YearAnchor {
        if (lineIndex < 0) {
            throw new IllegalArgumentException("Anchor line index must be non-negative");
        }
    }
}
