package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.domain.publication.ClassifiedLine;
import com.williamcallahan.publist.domain.publication.LineKind;
import com.williamcallahan.publist.domain.publication.ScanWindow;
import java.util.List;
import java.util.Optional;

/**
 * Walks a window from a start index toward its lower bound looking for one line kind.
 *
 * <p>Shared by the quartile and title scanners. Lines of other kinds are passed over; a year
 * anchor line ends the walk without a match.</p>
 */
final class BackwardLineScan {

    private BackwardLineScan() {}

    /**
     * Finds the line of the target kind nearest to {@code startIndex}, moving toward earlier lines.
     *
     * @param lines classified lines of the whole input
     * @param window bounds of the walk
     * @param startIndex first index examined; clamped to the window
     * @param target kind to find
     * @return nearest matching line, or empty when the bound or an anchor is reached first
     */
    static Optional<ClassifiedLine> findNearest(
            List<ClassifiedLine> lines, ScanWindow window, int startIndex, LineKind target) {
        int cursor = Math.min(startIndex, window.upperBoundExclusive() - 1);
        for (; cursor > window.lowerBoundExclusive(); cursor--) {
            ClassifiedLine line = lines.get(cursor);
            if (line.is(target)) {
                return Optional.of(line);
            }
            if (line.is(LineKind.YEAR_ANCHOR)) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
