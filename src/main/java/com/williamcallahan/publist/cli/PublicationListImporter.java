package com.williamcallahan.publist.cli;

import com.williamcallahan.publist.config.AppProperties;
import com.williamcallahan.publist.domain.publication.PublicationOutcome;
import com.williamcallahan.publist.domain.publication.PublicationParseResult;
import com.williamcallahan.publist.domain.publication.PublicationParseSummary;
import com.williamcallahan.publist.service.PublicationImportService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Parses a pasted publication list file at startup and logs every outcome.
 *
 * <p>Enabled by setting {@code app.import.file}, e.g.
 * {@code java -jar publist.jar --app.import.file=pasted.txt}.</p>
 */
@Component
@ConditionalOnProperty(prefix = "app.import", name = "file")
public class PublicationListImporter implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(PublicationListImporter.class);

    private final PublicationImportService publicationImportService;
    private final AppProperties appProperties;

    public PublicationListImporter(PublicationImportService publicationImportService, AppProperties appProperties) {
        this.publicationImportService = publicationImportService;
        this.appProperties = appProperties;
    }

    @Override
    public void run(String... args) {
        Path file = Paths.get(appProperties.getImport().getFile());
        importFile(file);
    }

    /**
     * Reads and parses one file.
     *
     * @param file UTF-8 text file holding a pasted publication list
     * @return parse result
     * @throws UncheckedIOException when the file cannot be read
     */
    public PublicationParseResult importFile(Path file) {
        String rawText;
        try {
            rawText = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read publication list " + file.toAbsolutePath(), e);
        }

        log.info("Importing publication list from {}", file.toAbsolutePath());
        PublicationParseResult result = publicationImportService.parse(rawText);
        for (PublicationOutcome outcome : result.outcomes()) {
            if (outcome instanceof PublicationOutcome.Extracted extracted) {
                log.info("  [{}] {} ({})", extracted.quartile(), extracted.title(), extracted.year());
            } else if (outcome instanceof PublicationOutcome.Skipped skipped) {
                log.warn("  Skipped entry for {}: {}", skipped.year(), skipped.reason());
            }
        }

        PublicationParseSummary summary = result.summary();
        if (!summary.hasExtracted()) {
            log.warn("No publications extracted from {}", file.toAbsolutePath());
        }
        log.info("Import finished: {} extracted, {} skipped", summary.extracted(), summary.skipped());
        return result;
    }
}
