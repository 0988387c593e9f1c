package com.williamcallahan.publist.domain.publication;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-anchor parse result: an extracted record or a skip with its reason.
 */
public sealed interface PublicationOutcome
        permits PublicationOutcome.Extracted, PublicationOutcome.Skipped {

    /** Shortest title an extracted record may carry. */
    int MIN_TITLE_LENGTH = 10;

    /**
     * Returns the anchor year this outcome was produced for.
     */
    int year();

    /**
     * Returns true when a complete record was extracted.
     */
    boolean isExtracted();

    /**
     * Returns the skip reason when the anchor was rejected.
     */
    Optional<SkipReason> skipReason();

    static PublicationOutcome extracted(String title, int year, Quartile quartile) {
        return new Extracted(title, year, quartile);
    }

    static PublicationOutcome skipped(int year, SkipReason reason) {
        return new Skipped(year, reason);
    }

    record Extracted(String title, int year, Quartile quartile) implements PublicationOutcome {
        public Extracted {
            Objects.requireNonNull(title, "title");
            Objects.requireNonNull(quartile, "quartile");
            if (title.length() < MIN_TITLE_LENGTH) {
                throw new IllegalArgumentException(
                        "Title must be at least " + MIN_TITLE_LENGTH + " characters: " + title);
            }
        }

        @Override
        public boolean isExtracted() {
            return true;
        }

        @Override
        public Optional<SkipReason> skipReason() {
            return Optional.empty();
        }
    }

    record Skipped(int year, SkipReason reason) implements PublicationOutcome {
        public Skipped {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isExtracted() {
            return false;
        }

        @Override
        public Optional<SkipReason> skipReason() {
            return Optional.of(reason);
        }
    }
}
