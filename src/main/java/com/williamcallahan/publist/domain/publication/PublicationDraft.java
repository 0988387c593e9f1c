package com.williamcallahan.publist.domain.publication;

import java.util.Objects;

/**
 * An extracted record shaped like a stored publication row, ready for a persistence collaborator.
 *
 * @param title publication title, at most {@link #MAX_TITLE_LENGTH} characters
 * @param pubYear publication year
 * @param type publication type key; quartile rankings only apply to journals
 * @param ranking lower-case ranking key, e.g. {@code "q2"}
 */
public record PublicationDraft(String title, int pubYear, String type, String ranking) {

    public static final int MAX_TITLE_LENGTH = 500;
    static final String JOURNAL_TYPE = "journal";

    public PublicationDraft {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(ranking, "ranking");
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Title exceeds " + MAX_TITLE_LENGTH + " characters");
        }
    }

    /**
     * Maps an extracted outcome onto the stored field names, truncating overlong titles.
     *
     * @param extracted extracted outcome
     * @return journal draft carrying the outcome's ranking key
     */
    public static PublicationDraft fromExtracted(PublicationOutcome.Extracted extracted) {
        Objects.requireNonNull(extracted, "extracted");
        String title = extracted.title();
        if (title.length() > MAX_TITLE_LENGTH) {
            int end = MAX_TITLE_LENGTH;
            // keep surrogate pairs whole
            if (Character.isHighSurrogate(title.charAt(end - 1))) {
                end--;
            }
            title = title.substring(0, end);
        }
        return new PublicationDraft(title, extracted.year(), JOURNAL_TYPE, extracted.quartile().rankingKey());
    }
}
