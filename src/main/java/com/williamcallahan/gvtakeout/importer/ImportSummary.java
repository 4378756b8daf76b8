package com.williamcallahan.gvtakeout.importer;

import java.util.List;

/**
 * Totals of one import run.
 *
 * @param filesSeen markup files found in the input directory
 * @param imported files whose conversation reached the sink
 * @param failures one entry per file that did not
 */
public record ImportSummary(int filesSeen, int imported, List<ImportFailure> failures) {

    public ImportSummary {
        failures = List.copyOf(failures);
        if (imported + failures.size() != filesSeen) {
            throw new IllegalArgumentException("Imported (" + imported + ") plus failed (" + failures.size()
                    + ") must equal files seen (" + filesSeen + ")");
        }
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
