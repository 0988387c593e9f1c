package com.williamcallahan.publist.domain.publication;

import java.util.Objects;

/**
 * Half-open line range {@code (lowerBoundExclusive, upperBoundExclusive)} searched for one anchor.
 *
 * <p>The upper bound is the anchor line itself; the lower bound is the previous anchor's line,
 * or {@code -1} for the first anchor.</p>
 *
 * @param anchor the anchor this window belongs to
 * @param lowerBoundExclusive first index that must not be read, scanning upward
 * @param upperBoundExclusive the anchor line index
 */
public record ScanWindow(YearAnchor anchor, int lowerBoundExclusive, int upperBoundExclusive) {

    public ScanWindow {
        Objects.requireNonNull(anchor, "anchor");
        if (lowerBoundExclusive < -1) {
            throw new IllegalArgumentException("Lower bound must be -1 or greater");
        }
        if (lowerBoundExclusive >= upperBoundExclusive) {
            throw new IllegalArgumentException("Lower bound must precede the upper bound");
        }
    }

    /**
     * Returns true when the index lies strictly inside the window.
     */
    public boolean contains(int lineIndex) {
        return lineIndex > lowerBoundExclusive && lineIndex < upperBoundExclusive;
    }

    /**
     * Returns the number of lines strictly between the bounds.
     */
    public int size() {
        return upperBoundExclusive - lowerBoundExclusive - 1;
    }
}
