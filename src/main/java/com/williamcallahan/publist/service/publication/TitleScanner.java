package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.domain.publication.ClassifiedLine;
import com.williamcallahan.publist.domain.publication.LineKind;
import com.williamcallahan.publist.domain.publication.ScanWindow;
import java.util.List;
import java.util.Optional;

/**
 * Finds the title of a record: the first content line above the quartile match, or above the
 * anchor when no quartile was found.
 *
 * <p>Only one line is taken. A title wrapped over two pasted lines yields its last line.</p>
 */
final class TitleScanner {

    private TitleScanner() {}

    static Optional<ClassifiedLine> scan(
            List<ClassifiedLine> lines, ScanWindow window, Optional<ClassifiedLine> quartileMatch) {
        int startIndex = quartileMatch
                .map(match -> match.index() - 1)
                .orElse(window.upperBoundExclusive() - 1);
        return BackwardLineScan.findNearest(lines, window, startIndex, LineKind.CONTENT);
    }
}
