package com.williamcallahan.publist.config;

import java.util.Locale;

/**
 * Command-line import settings.
 */
public class ImportConfig {

    private static final String FILE_KEY = "app.import.file";
    private static final String BLANK_TEXT_FMT = "%s must not be blank when set.";

    private String file;

    /**
     * Validates import settings. An unset file disables the import run.
     */
    public void validateConfiguration() {
        if (file != null && file.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_TEXT_FMT, FILE_KEY));
        }
    }

    /**
     * Returns the pasted-list file to import at startup, or null when none is configured.
     *
     * @return import file path
     */
    public String getFile() {
        return file;
    }

    public void setFile(final String file) {
        this.file = file;
    }
}
