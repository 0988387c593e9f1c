package com.williamcallahan.publist.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.publist.domain.publication.PublicationOutcome;
import java.util.Objects;

/**
 * JSON shape of one parse outcome, tagged by the {@code outcome} field.
 *
 * @param outcome "extracted" or "skipped"
 * @param year anchor year
 * @param title extracted title, absent for skips
 * @param quartile extracted quartile name, absent for skips
 * @param reason skip reason, absent for extracted records
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublicationOutcomeView(String outcome, int year, String title, String quartile, String reason) {

    private static final String EXTRACTED = "extracted";
    private static final String SKIPPED = "skipped";

    public PublicationOutcomeView {
        Objects.requireNonNull(outcome, "outcome");
    }

    static PublicationOutcomeView from(PublicationOutcome outcome) {
        if (outcome instanceof PublicationOutcome.Extracted extracted) {
            return new PublicationOutcomeView(
                    EXTRACTED, extracted.year(), extracted.title(), extracted.quartile().name(), null);
        }
        PublicationOutcome.Skipped skipped = (PublicationOutcome.Skipped) outcome;
        return new PublicationOutcomeView(SKIPPED, skipped.year(), null, null, skipped.reason().name());
    }
}
