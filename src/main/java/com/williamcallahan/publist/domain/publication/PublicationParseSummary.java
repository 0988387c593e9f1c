package com.williamcallahan.publist.domain.publication;

import java.util.List;
import java.util.Objects;

/**
 * Counts describing one parse so callers can apply their own "nothing found" policy.
 *
 * @param anchors number of year anchors detected
 * @param extracted number of extracted records
 * @param skipped number of skipped anchors
 * @param missingTitle skipped anchors without a title
 * @param missingQuartile skipped anchors without a quartile
 */
public record PublicationParseSummary(int anchors, int extracted, int skipped, int missingTitle, int missingQuartile) {

    public PublicationParseSummary {
        if (anchors < 0 || extracted < 0 || skipped < 0 || missingTitle < 0 || missingQuartile < 0) {
            throw new IllegalArgumentException("Summary counts must be non-negative");
        }
        if (extracted + skipped != anchors) {
            throw new IllegalArgumentException("Extracted and skipped counts must add up to the anchor count");
        }
        if (missingTitle + missingQuartile != skipped) {
            throw new IllegalArgumentException("Skip reason counts must add up to the skipped count");
        }
    }

    /**
     * Tallies a list of outcomes.
     *
     * @param outcomes parse outcomes
     * @return summary of the outcomes
     */
    public static PublicationParseSummary of(List<PublicationOutcome> outcomes) {
        Objects.requireNonNull(outcomes, "outcomes");
        int extracted = 0;
        int missingTitle = 0;
        int missingQuartile = 0;
        for (PublicationOutcome outcome : outcomes) {
            if (outcome instanceof PublicationOutcome.Skipped skipped) {
                if (skipped.reason() == SkipReason.MISSING_TITLE) {
                    missingTitle++;
                } else {
                    missingQuartile++;
                }
            } else {
                extracted++;
            }
        }
        return new PublicationParseSummary(
                outcomes.size(), extracted, missingTitle + missingQuartile, missingTitle, missingQuartile);
    }

    public boolean hasExtracted() {
        return extracted > 0;
    }

    /**
     * Returns true when every anchor produced a record.
     */
    public boolean isClean() {
        return skipped == 0;
    }
}
