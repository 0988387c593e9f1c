package com.williamcallahan.publist.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the {@code app.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private PublicationParsingConfig parser = new PublicationParsingConfig();
    private ImportConfig importer = new ImportConfig();

    /**
     * Fails startup when any nested section is invalid.
     */
    @PostConstruct
    public void validateConfiguration() {
        parser.validateConfiguration();
        importer.validateConfiguration();
    }

    public PublicationParsingConfig getParser() {
        return parser;
    }

    public void setParser(PublicationParsingConfig parser) {
        this.parser = parser;
    }

    /**
     * Bound from {@code app.import.*}; {@code import} is a reserved word.
     */
    public ImportConfig getImport() {
        return importer;
    }

    public void setImport(ImportConfig importer) {
        this.importer = importer;
    }
}
