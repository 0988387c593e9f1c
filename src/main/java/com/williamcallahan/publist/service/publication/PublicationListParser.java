package com.williamcallahan.publist.service.publication;

import com.williamcallahan.publist.config.PublicationParsingConfig;
import com.williamcallahan.publist.domain.publication.ClassifiedLine;
import com.williamcallahan.publist.domain.publication.PublicationOutcome;
import com.williamcallahan.publist.domain.publication.RawLine;
import com.williamcallahan.publist.domain.publication.ScanWindow;
import com.williamcallahan.publist.domain.publication.YearAnchor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Extracts ranked publication records from a pasted publication list.
 *
 * <p>Pipeline:</p>
 * <ol>
 *   <li>Normalize the text into trimmed non-empty lines</li>
 *   <li>Classify every line once</li>
 *   <li>Collect year anchors top to bottom</li>
 *   <li>Per anchor: bound the window by the previous anchor, find the nearest quartile above the
 *       anchor, then the nearest content line above that</li>
 *   <li>Assemble an extracted record or a skip</li>
 * </ol>
 *
 * <p>Parsing never throws for any input and keeps no state between calls, so one instance can
 * serve concurrent callers.</p>
 */
public final class PublicationListParser {

    private final LineClassifier classifier;

    public PublicationListParser(LineClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public static PublicationListParser from(PublicationParsingConfig config) {
        return new PublicationListParser(LineClassifier.from(config));
    }

    public static PublicationListParser withDefaults() {
        return new PublicationListParser(LineClassifier.withDefaults());
    }

    /**
     * Parses a pasted block into one outcome per year anchor.
     *
     * @param rawText pasted text (may be null or empty)
     * @return outcomes in the order their anchors appear in the text
     */
    public List<PublicationOutcome> parse(String rawText) {
        List<RawLine> rawLines = LineNormalizer.normalize(rawText);
        List<ClassifiedLine> lines = classifier.classifyAll(rawLines);
        List<YearAnchor> anchors = YearAnchorScanner.scan(lines);

        List<PublicationOutcome> outcomes = new ArrayList<>(anchors.size());
        for (ScanWindow window : ScanWindowBuilder.build(anchors)) {
            Optional<ClassifiedLine> quartileLine = QuartileScanner.scan(lines, window);
            Optional<ClassifiedLine> titleLine = TitleScanner.scan(lines, window, quartileLine);
            outcomes.add(PublicationRecordAssembler.assemble(
                    window.anchor(),
                    quartileLine.flatMap(ClassifiedLine::quartile),
                    titleLine.map(ClassifiedLine::text)));
        }
        return List.copyOf(outcomes);
    }
}
