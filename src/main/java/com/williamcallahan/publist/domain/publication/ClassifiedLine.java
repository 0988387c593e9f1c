package com.williamcallahan.publist.domain.publication;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A line paired with its classification and the value extracted for that classification.
 *
 * @param line source line
 * @param kind classification
 * @param extractedYear year for {@link LineKind#YEAR_ANCHOR} lines, null otherwise
 * @param extractedQuartile quartile for {@link LineKind#QUARTILE} lines, null otherwise
 */
public record ClassifiedLine(RawLine line, LineKind kind, Integer extractedYear, Quartile extractedQuartile) {

    public ClassifiedLine {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(kind, "kind");
        if ((kind == LineKind.YEAR_ANCHOR) != (extractedYear != null)) {
            throw new IllegalArgumentException("Year must be present exactly for year anchor lines");
        }
        if ((kind == LineKind.QUARTILE) != (extractedQuartile != null)) {
            throw new IllegalArgumentException("Quartile must be present exactly for quartile lines");
        }
    }

    public static ClassifiedLine anchorLine(RawLine line, int year) {
        return new ClassifiedLine(line, LineKind.YEAR_ANCHOR, year, null);
    }

    public static ClassifiedLine quartileLine(RawLine line, Quartile quartile) {
        return new ClassifiedLine(line, LineKind.QUARTILE, null, Objects.requireNonNull(quartile, "quartile"));
    }

    public static ClassifiedLine metadataLine(RawLine line) {
        return new ClassifiedLine(line, LineKind.METADATA, null, null);
    }

    public static ClassifiedLine contentLine(RawLine line) {
        return new ClassifiedLine(line, LineKind.CONTENT, null, null);
    }

    public boolean is(LineKind candidate) {
        return kind == candidate;
    }

    public OptionalInt year() {
        return extractedYear == null ? OptionalInt.empty() : OptionalInt.of(extractedYear);
    }

    public Optional<Quartile> quartile() {
        return Optional.ofNullable(extractedQuartile);
    }

    public String text() {
        return line.text();
    }

    public int index() {
        return line.index();
    }
}
