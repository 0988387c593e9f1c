package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.domain.publication.ClassifiedLine;
import com.williamcallahan.publist.domain.publication.LineKind;
import com.williamcallahan.publist.domain.publication.ScanWindow;
import java.util.List;
import java.util.Optional;

/**
 * Finds the quartile line closest above an anchor.
 */
final class QuartileScanner {

    private QuartileScanner() {}

    static Optional<ClassifiedLine> scan(List<ClassifiedLine> lines, ScanWindow window) {
        return BackwardLineScan.findNearest(lines, window, window.upperBoundExclusive() - 1, LineKind.QUARTILE);
    }
}
