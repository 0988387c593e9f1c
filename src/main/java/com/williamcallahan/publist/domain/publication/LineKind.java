package com.williamcallahan.publist.domain.publication;

/**
 * Classification assigned to each normalized line of a pasted publication list.
 */
public enum LineKind {
    /** Carries the publication year of one record. */
    YEAR_ANCHOR,
    /** Standalone quartile token. */
    QUARTILE,
    /** Metric labels, placeholders, numbering and other short noise. */
    METADATA,
    /** Anything else; title candidates. */
    CONTENT
}
