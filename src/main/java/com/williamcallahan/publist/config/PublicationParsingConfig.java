package com.williamcallahan.publist.config;

import com.williamcallahan.publist.domain.publication.PublicationOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Heuristic settings for the pasted publication list parser.
 */
public class PublicationParsingConfig {

    private static final int MIN_YEAR_DEF = 2000;
    private static final int MAX_YEAR_DEF = 2099;
    private static final int MIN_CONTENT_DEF = 10;
    private static final int MAX_INPUT_DEF = 200_000;
    private static final List<String> PREFIXES_DEF = List.of("ABS", "ABDC", "SJR", "SNIP", "CiteScore");
    private static final int YEAR_FLOOR = 1900;
    private static final int YEAR_CEILING = 2100;
    private static final int CONTENT_FLOOR = PublicationOutcome.MIN_TITLE_LENGTH;
    private static final int MIN_POSITIVE = 1;
    private static final String MIN_YEAR_KEY = "app.parser.min-year";
    private static final String MAX_YEAR_KEY = "app.parser.max-year";
    private static final String MIN_CONTENT_KEY = "app.parser.min-content-length";
    private static final String PREFIXES_KEY = "app.parser.metadata-prefixes";
    private static final String MAX_INPUT_KEY = "app.parser.max-input-length";
    private static final String RANGE_FMT = "%s must be between %d and %d (got %d).";
    private static final String ORDER_FMT = "%s must be less than or equal to %s (got %d > %d).";
    private static final String AT_LEAST_FMT = "%s must be at least %d (got %d).";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String EMPTY_LIST_FMT = "%s must list at least one prefix.";
    private static final String BLANK_ENTRY_FMT = "%s must not contain blank entries.";

    private int minYear = MIN_YEAR_DEF;
    private int maxYear = MAX_YEAR_DEF;
    private int minContentLength = MIN_CONTENT_DEF;
    private int maxInputLength = MAX_INPUT_DEF;
    private List<String> metadataPrefixes = new ArrayList<>(PREFIXES_DEF);

    /**
     * Creates parser configuration with the documented defaults.
     */
    public PublicationParsingConfig() {}

    /**
     * Validates parser settings.
     */
    public void validateConfiguration() {
        requireYearInRange(MIN_YEAR_KEY, minYear);
        requireYearInRange(MAX_YEAR_KEY, maxYear);
        if (minYear > maxYear) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, ORDER_FMT, MIN_YEAR_KEY, MAX_YEAR_KEY, minYear, maxYear));
        }
        if (minContentLength < CONTENT_FLOOR) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, AT_LEAST_FMT, MIN_CONTENT_KEY, CONTENT_FLOOR, minContentLength));
        }
        if (maxInputLength < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_INPUT_KEY));
        }
        if (metadataPrefixes == null || metadataPrefixes.isEmpty()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, EMPTY_LIST_FMT, PREFIXES_KEY));
        }
        for (String prefix : metadataPrefixes) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_ENTRY_FMT, PREFIXES_KEY));
            }
        }
    }

    /**
     * Returns the earliest year accepted as an anchor.
     *
     * @return earliest anchor year
     */
    public int getMinYear() {
        return minYear;
    }

    public void setMinYear(final int minYear) {
        this.minYear = minYear;
    }

    /**
     * Returns the latest year accepted as an anchor.
     *
     * @return latest anchor year
     */
    public int getMaxYear() {
        return maxYear;
    }

    public void setMaxYear(final int maxYear) {
        this.maxYear = maxYear;
    }

    /**
     * Returns the shortest trimmed line length that can count as title content.
     *
     * @return minimum content line length
     */
    public int getMinContentLength() {
        return minContentLength;
    }

    public void setMinContentLength(final int minContentLength) {
        this.minContentLength = minContentLength;
    }

    /**
     * Returns the largest pasted block, in characters, the service accepts.
     *
     * @return maximum input length
     */
    public int getMaxInputLength() {
        return maxInputLength;
    }

    public void setMaxInputLength(final int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }

    /**
     * Returns the metric labels whose lines are skipped while looking for a title.
     *
     * @return metadata line prefixes
     */
    public List<String> getMetadataPrefixes() {
        return metadataPrefixes;
    }

    public void setMetadataPrefixes(final List<String> metadataPrefixes) {
        this.metadataPrefixes = metadataPrefixes == null ? new ArrayList<>() : new ArrayList<>(metadataPrefixes);
    }

    private static void requireYearInRange(final String propertyKey, final int year) {
        if (year < YEAR_FLOOR || year > YEAR_CEILING) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, RANGE_FMT, propertyKey, YEAR_FLOOR, YEAR_CEILING, year));
        }
    }
}
