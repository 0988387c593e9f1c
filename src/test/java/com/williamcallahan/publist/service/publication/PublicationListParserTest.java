package com.williamcallahan.publist.service.publication;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.publist.domain.publication.PublicationOutcome;
import com.williamcallahan.publist.domain.publication.Quartile;
import com.williamcallahan.publist.domain.publication.SkipReason;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies end-to-end extraction over pasted publication lists.
 */
class PublicationListParserTest {

    private static final String RANKED_LIST_RESOURCE = "/publications/ranked-publication-list.txt";

    private final PublicationListParser parser = PublicationListParser.withDefaults();

    private static String loadRankedList() throws IOException {
        try (InputStream input = PublicationListParserTest.class.getResourceAsStream(RANKED_LIST_RESOURCE)) {
            assertNotNull(input, "missing test resource " + RANKED_LIST_RESOURCE);
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void parse_emptyInput_returnsNoOutcomes() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("\n\n   \n").isEmpty());
    }

    @Test
    void parse_titleShorterThanMinimum_isMissingTitle() {
        List<PublicationOutcome> outcomes = parser.parse("IoT Paper\nQ1\n2023");

        assertEquals(List.of(PublicationOutcome.skipped(2023, SkipReason.MISSING_TITLE)), outcomes);
    }

    @Test
    void parse_rankedList_extractsSixteenAndSkipsThePomodoroEntry() throws IOException {
        List<PublicationOutcome> outcomes = parser.parse(loadRankedList());

        assertEquals(17, outcomes.size());
        assertEquals(16, outcomes.stream().filter(PublicationOutcome::isExtracted).count());

        List<PublicationOutcome> skipped = outcomes.stream().filter(outcome -> !outcome.isExtracted()).toList();
        assertEquals(List.of(new PublicationOutcome.Skipped(2021, SkipReason.MISSING_QUARTILE)), skipped);
        assertEquals(skipped.get(0), outcomes.get(16));
    }

    @Test
    void parse_rankedList_recoversTitlesQuartilesAndYears() throws IOException {
        List<PublicationOutcome> outcomes = parser.parse(loadRankedList());

        assertEquals(new PublicationOutcome.Extracted(
                "Deep Learning Based Detection of Diabetic Retinopathy from Retinal Fundus Images", 2023, Quartile.Q1),
                outcomes.get(0));
        assertEquals(new PublicationOutcome.Extracted(
                "Bangla Handwritten Character Recognition Using Capsule Networks", 2021, Quartile.Q1),
                outcomes.get(2));
        assertEquals(new PublicationOutcome.Extracted(
                "Predicting Student Dropout in Higher Education Using Ensemble Classifiers", 2019, Quartile.Q4),
                outcomes.get(8));
        assertEquals(new PublicationOutcome.Extracted(
                "A Survey of Large Language Model Evaluation Benchmarks for Low-Resource Languages", 2024, Quartile.Q4),
                outcomes.get(15));
    }

    @Test
    void parse_rankedList_keepsInputYearOrder() throws IOException {
        List<Integer> years = new ArrayList<>();
        for (PublicationOutcome outcome : parser.parse(loadRankedList())) {
            years.add(outcome.year());
        }

        assertEquals(List.of(2023, 2022, 2021, 2023, 2020, 2022, 2021, 2024, 2019,
                2020, 2023, 2022, 2021, 2024, 2022, 2024, 2021), years);
    }

    @Test
    void parse_extractedRecordsHoldTheirInvariants() throws IOException {
        for (PublicationOutcome outcome : parser.parse(loadRankedList())) {
            assertTrue(outcome.year() >= 2000 && outcome.year() <= 2099);
            if (outcome instanceof PublicationOutcome.Extracted extracted) {
                assertTrue(extracted.title().length() >= PublicationOutcome.MIN_TITLE_LENGTH);
                assertNotNull(extracted.quartile());
            }
        }
    }

    @Test
    void parse_sameInputTwice_returnsEqualResults() throws IOException {
        String rankedList = loadRankedList();

        assertEquals(parser.parse(rankedList), parser.parse(rankedList));
    }

    @Test
    void parse_adjacentAnchors_skipWithoutBorrowingFromNeighbors() {
        String text = String.join("\n",
                "Optimizing Solar Microgrid Dispatch",
                "Q1",
                "29\t2022",
                "2023",
                "2024");

        List<PublicationOutcome> outcomes = parser.parse(text);

        assertEquals(List.of(
                new PublicationOutcome.Extracted("Optimizing Solar Microgrid Dispatch", 2022, Quartile.Q1),
                new PublicationOutcome.Skipped(2023, SkipReason.MISSING_TITLE),
                new PublicationOutcome.Skipped(2024, SkipReason.MISSING_TITLE)), outcomes);
    }

    @Test
    void parse_anchorAtDocumentStart_isMissingTitle() {
        assertEquals(List.of(new PublicationOutcome.Skipped(2021, SkipReason.MISSING_TITLE)), parser.parse("12\t2021"));
    }

    @Test
    void parse_quartileWithoutTitleAboveIt_isMissingTitle() {
        List<PublicationOutcome> outcomes = parser.parse("SJR Q2; 0.51\nQ2\n2020");

        assertEquals(List.of(new PublicationOutcome.Skipped(2020, SkipReason.MISSING_TITLE)), outcomes);
    }

    @Test
    void parse_titleWithoutQuartile_isMissingQuartile() {
        List<PublicationOutcome> outcomes = parser.parse("Conference paper on edge caching\nNA\n2020");

        assertEquals(List.of(new PublicationOutcome.Skipped(2020, SkipReason.MISSING_QUARTILE)), outcomes);
    }

    @Test
    void parse_compositeQuartileLine_doesNotCountAsQuartile() {
        List<PublicationOutcome> outcomes = parser.parse("Some Journal Paper Title\nSJR Q1; 0.849\n48\t2023");

        assertEquals(List.of(new PublicationOutcome.Skipped(2023, SkipReason.MISSING_QUARTILE)), outcomes);
    }

    @Test
    void parse_textWithoutYears_returnsNoOutcomes() {
        assertTrue(parser.parse("A title without any year\nQ1\nABS: NA").isEmpty());
    }
}
