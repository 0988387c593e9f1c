package com.williamcallahan.publist.domain.publication;

/**
 * Why an anchor did not produce an extracted record.
 */
public enum SkipReason {
    MISSING_TITLE,
    MISSING_QUARTILE
}
