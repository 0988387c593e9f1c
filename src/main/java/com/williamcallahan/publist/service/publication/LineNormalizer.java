package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.domain.publication.RawLine;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a pasted text block into trimmed, non-empty lines.
 *
 * <p>Indexes count surviving lines only, so blank lines never leave gaps.</p>
 */
public final class LineNormalizer {

    private LineNormalizer() {}

    /**
     * Splits on any line terminator, trims each line and drops the empty ones.
     *
     * @param rawText pasted text (may be null or empty)
     * @return ordered lines, empty when nothing survives
     */
    public static List<RawLine> normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return List.of();
        }
        List<RawLine> lines = new ArrayList<>();
        rawText.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .forEach(line -> lines.add(new RawLine(line, lines.size())));
        return List.copyOf(lines);
    }
}
