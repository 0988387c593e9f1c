package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.config.PublicationParsingConfig;
import com.williamcallahan.publist.domain.publication.ClassifiedLine;
import com.williamcallahan.publist.domain.publication.PublicationOutcome;
import com.williamcallahan.publist.domain.publication.Quartile;
import com.williamcallahan.publist.domain.publication.RawLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a single line of a pasted publication list.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 *   <li>Quartile: the whole line is exactly Q1, Q2, Q3 or Q4</li>
 *   <li>Year anchor: the line holds a standalone 4-digit number inside the year range; the
 *       rightmost such number is the year, so {@code "48\t2023"} yields 2023</li>
 *   <li>Metadata: {@code "NA"}, a metric prefix such as {@code "SJR Q1; 0.849"}, a line without
 *       letters, or a line shorter than the minimum content length</li>
 *   <li>Content: everything else</li>
 * </ol>
 *
 * <p>Instances are immutable and never look at neighboring lines.</p>
 */
public final class LineClassifier {

    private static final Pattern FOUR_DIGIT_NUMBER = Pattern.compile("(?<!\\d)\\d{4}(?!\\d)");
    private static final String NOT_AVAILABLE = "NA";

    private final int minYear;
    private final int maxYear;
    private final int minContentLength;
    private final List<String> metadataPrefixes;

    /**
     * Creates a classifier.
     *
     * @param minYear earliest anchor year, inclusive
     * @param maxYear latest anchor year, inclusive
     * @param minContentLength shortest line that can be title content
     * @param metadataPrefixes case-sensitive metric labels marking metadata lines
     * @throws IllegalArgumentException when the year range is inverted, the content threshold is
     *         below {@link PublicationOutcome#MIN_TITLE_LENGTH}, or a prefix is blank
     */
    public LineClassifier(int minYear, int maxYear, int minContentLength, List<String> metadataPrefixes) {
        if (minYear > maxYear) {
            throw new IllegalArgumentException("minYear must not exceed maxYear");
        }
        // shorter content lines would become titles that Extracted rejects
        if (minContentLength < PublicationOutcome.MIN_TITLE_LENGTH) {
            throw new IllegalArgumentException(
                    "minContentLength must be at least " + PublicationOutcome.MIN_TITLE_LENGTH
                            + " (got " + minContentLength + ")");
        }
        Objects.requireNonNull(metadataPrefixes, "metadataPrefixes");
        for (String prefix : metadataPrefixes) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("metadataPrefixes must not contain blank entries");
            }
        }
        this.minYear = minYear;
        this.maxYear = maxYear;
        this.minContentLength = minContentLength;
        this.metadataPrefixes = List.copyOf(metadataPrefixes);
    }

    /**
     * Creates a classifier from validated parser settings.
     */
    public static LineClassifier from(PublicationParsingConfig config) {
        Objects.requireNonNull(config, "config");
        return new LineClassifier(
                config.getMinYear(), config.getMaxYear(), config.getMinContentLength(), config.getMetadataPrefixes());
    }

    /**
     * Creates a classifier with the default year range, content threshold and prefixes.
     */
    public static LineClassifier withDefaults() {
        return from(new PublicationParsingConfig());
    }

    /**
     * Classifies one line.
     *
     * @param line normalized line
     * @return classified line carrying the extracted year or quartile where applicable
     */
    public ClassifiedLine classify(RawLine line) {
        Objects.requireNonNull(line, "line");
        String text = line.text();

        Optional<Quartile> quartile = Quartile.fromToken(text);
        if (quartile.isPresent()) {
            return ClassifiedLine.quartileLine(line, quartile.get());
        }
        OptionalInt year = lastYearIn(text);
        if (year.isPresent()) {
            return ClassifiedLine.anchorLine(line, year.getAsInt());
        }
        if (isMetadata(text)) {
            return ClassifiedLine.metadataLine(line);
        }
        return ClassifiedLine.contentLine(line);
    }

    /**
     * Classifies lines in order; the result is indexed exactly like the input.
     *
     * @param lines normalized lines
     * @return classified lines, one per input line
     */
    public List<ClassifiedLine> classifyAll(List<RawLine> lines) {
        List<ClassifiedLine> classified = new ArrayList<>(lines.size());
        for (RawLine line : lines) {
            classified.add(classify(line));
        }
        return classified;
    }

    OptionalInt lastYearIn(String text) {
        Matcher matcher = FOUR_DIGIT_NUMBER.matcher(text);
        OptionalInt last = OptionalInt.empty();
        while (matcher.find()) {
            int candidate = Integer.parseInt(matcher.group());
            if (candidate >= minYear && candidate <= maxYear) {
                last = OptionalInt.of(candidate);
            }
        }
        return last;
    }

    boolean isMetadata(String text) {
        if (NOT_AVAILABLE.equals(text)) {
            return true;
        }
        if (text.length() < minContentLength) {
            return true;
        }
        return startsWithMetadataPrefix(text) || !containsLetter(text);
    }

    private boolean startsWithMetadataPrefix(String text) {
        for (String prefix : metadataPrefixes) {
            if (!text.startsWith(prefix)) {
                continue;
            }
            // "SJR: 0.8" is a label, "ABSORBING..." is not
            if (text.length() == prefix.length() || !Character.isLetter(text.charAt(prefix.length()))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsLetter(String text) {
        for (int index = 0; index < text.length(); index++) {
            if (Character.isLetter(text.charAt(index))) {
                return true;
            }
        }
        return false;
    }
}
