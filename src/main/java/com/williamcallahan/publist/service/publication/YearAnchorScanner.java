package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.domain.publication.ClassifiedLine;
import com.williamcallahan.publist.domain.publication.LineKind;
import com.williamcallahan.publist.domain.publication.YearAnchor;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects one anchor per year line, top to bottom.
 *
 * <p>Adjacent anchors are kept apart even with nothing between them; the scanners downstream
 * then report the missing fields instead of merging unrelated entries.</p>
 */
final class YearAnchorScanner {

    private YearAnchorScanner() {}

    static List<YearAnchor> scan(List<ClassifiedLine> lines) {
        List<YearAnchor> anchors = new ArrayList<>();
        for (ClassifiedLine line : lines) {
            if (line.is(LineKind.YEAR_ANCHOR)) {
                anchors.add(new YearAnchor(line.index(), line.extractedYear()));
            }
        }
        return anchors;
    }
}
