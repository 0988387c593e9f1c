package com.williamcallahan.publist.service.publication;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.publist.domain.publication.ClassifiedLine;
import com.williamcallahan.publist.domain.publication.Quartile;
import com.williamcallahan.publist.domain.publication.ScanWindow;
import com.williamcallahan.publist.domain.publication.YearAnchor;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Verifies the upward quartile search and its window limits.
 */
class QuartileScannerTest {

    private static List<ClassifiedLine> classify(String... lines) {
        return LineClassifier.withDefaults().classifyAll(LineNormalizer.normalize(String.join("\n", lines)));
    }

    @Test
    void scan_takesQuartileClosestToAnchor() {
        List<ClassifiedLine> lines = classify(
                "Some paper title here",
                "Q3",
                "SJR Q1; 0.849",
                "Q1",
                "CiteScore 9.4",
                "48\t2023");
        ScanWindow window = new ScanWindow(new YearAnchor(5, 2023), -1, 5);

        Optional<ClassifiedLine> match = QuartileScanner.scan(lines, window);

        assertEquals(3, match.orElseThrow().index());
        assertEquals(Quartile.Q1, match.orElseThrow().quartile().orElseThrow());
    }

    @Test
    void scan_passesOverTitleLines() {
        List<ClassifiedLine> lines = classify("Q2", "Some paper title here", "2021");
        ScanWindow window = new ScanWindow(new YearAnchor(2, 2021), -1, 2);

        assertEquals(0, QuartileScanner.scan(lines, window).orElseThrow().index());
    }

    @Test
    void scan_doesNotReadBelowLowerBound() {
        List<ClassifiedLine> lines = classify(
                "Q1",
                "Some paper title here",
                "NA",
                "2021");
        ScanWindow window = new ScanWindow(new YearAnchor(3, 2021), 0, 3);

        assertTrue(QuartileScanner.scan(lines, window).isEmpty());
    }

    @Test
    void scan_stopsAtAnchorInsideWindow() {
        List<ClassifiedLine> lines = classify(
                "Q1",
                "2020",
                "Some paper title here",
                "2021");
        ScanWindow oversized = new ScanWindow(new YearAnchor(3, 2021), -1, 3);

        assertTrue(QuartileScanner.scan(lines, oversized).isEmpty());
    }

    @Test
    void scan_emptyWindow_findsNothing() {
        List<ClassifiedLine> lines = classify("Q1", "2020", "2021");
        ScanWindow window = new ScanWindow(new YearAnchor(2, 2021), 1, 2);

        assertTrue(QuartileScanner.scan(lines, window).isEmpty());
    }
}
