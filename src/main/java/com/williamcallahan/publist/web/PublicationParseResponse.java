package com.williamcallahan.publist.web;

import com.williamcallahan.publist.domain.publication.PublicationDraft;
import com.williamcallahan.publist.domain.publication.PublicationParseResult;
import com.williamcallahan.publist.domain.publication.PublicationParseSummary;
import java.util.List;
import java.util.Objects;

/**
 * Response for a parsed publication list.
 *
 * @param outcomes per-anchor outcomes in input order
 * @param summary counts over the outcomes
 * @param drafts extracted records mapped to stored publication fields
 */
public record PublicationParseResponse(
        List<PublicationOutcomeView> outcomes, PublicationParseSummary summary, List<PublicationDraft> drafts) {

    public PublicationParseResponse {
        Objects.requireNonNull(summary, "summary");
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        drafts = drafts == null ? List.of() : List.copyOf(drafts);
    }

    static PublicationParseResponse from(PublicationParseResult result) {
        List<PublicationOutcomeView> views = result.outcomes().stream()
                .map(PublicationOutcomeView::from)
                .toList();
        return new PublicationParseResponse(views, result.summary(), result.drafts());
    }
}
