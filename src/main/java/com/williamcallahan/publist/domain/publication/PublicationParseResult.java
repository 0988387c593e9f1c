package com.williamcallahan.publist.domain.publication;

import java.util.List;
import java.util.Objects;

/**
 * Outcomes of one parse in anchor order, with their summary.
 *
 * @param outcomes per-anchor outcomes in the order anchors appear in the input
 * @param summary counts over the outcomes
 */
public record PublicationParseResult(List<PublicationOutcome> outcomes, PublicationParseSummary summary) {

    public PublicationParseResult {
        Objects.requireNonNull(outcomes, "outcomes");
        Objects.requireNonNull(summary, "summary");
        outcomes = List.copyOf(outcomes);
    }

    public static PublicationParseResult of(List<PublicationOutcome> outcomes) {
        return new PublicationParseResult(outcomes, PublicationParseSummary.of(outcomes));
    }

    public static PublicationParseResult empty() {
        return of(List.of());
    }

    /**
     * Maps every extracted outcome to a storable draft, preserving order.
     *
     * @return drafts for extracted outcomes only
     */
    public List<PublicationDraft> drafts() {
        return outcomes.stream()
                .filter(PublicationOutcome.Extracted.class::isInstance)
                .map(PublicationOutcome.Extracted.class::cast)
                .map(PublicationDraft::fromExtracted)
                .toList();
    }
}
