package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.domain.publication.ScanWindow;
import com.williamcallahan.publist.domain.publication.YearAnchor;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounds each anchor's search by the previous anchor's line.
 */
final class ScanWindowBuilder {

    private static final int DOCUMENT_START = -1;

    private ScanWindowBuilder() {}

    /**
     * Builds the window for the anchor at the given position of the ordered anchor list.
     */
    static ScanWindow windowFor(List<YearAnchor> anchors, int position) {
        YearAnchor anchor = anchors.get(position);
        int lowerBound = position > 0 ? anchors.get(position - 1).lineIndex() : DOCUMENT_START;
        return new ScanWindow(anchor, lowerBound, anchor.lineIndex());
    }

    static List<ScanWindow> build(List<YearAnchor> anchors) {
        List<ScanWindow> windows = new ArrayList<>(anchors.size());
        for (int position = 0; position < anchors.size(); position++) {
            windows.add(windowFor(anchors, position));
        }
        return windows;
    }
}
