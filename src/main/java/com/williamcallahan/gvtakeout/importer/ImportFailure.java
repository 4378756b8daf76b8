package com.williamcallahan.gvtakeout.importer;

import java.util.Objects;

/**
 * A single takeout file that could not be imported, with the phase that failed.
 *
 * @param filePath path of the export file
 * @param phase import phase that failed: {@code parse}, {@code extract} or {@code store}
 * @param details failure details for diagnostics
 */
public record ImportFailure(String filePath, String phase, String details) {

    public static final String PHASE_PARSE = "parse";
    public static final String PHASE_EXTRACT = "extract";
    public static final String PHASE_STORE = "store";

    public ImportFailure {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path is required");
        }
        if (phase == null || phase.isBlank()) {
            throw new IllegalArgumentException("Failure phase is required");
        }
        Objects.requireNonNull(details, "Failure details are required");
    }
}
