package dev.roshin.proofscanner.analysis.model;

import java.time.Duration;
import java.util.List;

/**
 * Contains metadata and statistics about the analysis run.
 *
 * @param totalReportsScanned Number of report files found under the analyzed root
 * @param totalEntities       Number of entities loaded
 * @param totalProofItems     Number of proof items loaded
 * @param totalAttempts       Number of proof attempts loaded
 * @param warnings            Warnings generated during analysis (e.g., unreadable reports)
 * @param analysisTime        Duration of the analysis
 * @param hadErrors           Whether any errors occurred during analysis
 * @param skippedFiles        Report files that couldn't be loaded
 */
public record AnalysisMetadata(
        int totalReportsScanned,
        int totalEntities,
        int totalProofItems,
        int totalAttempts,
        List<String> warnings,
        Duration analysisTime,
        boolean hadErrors,
        List<String> skippedFiles
) {
    @Override
    public String toString() {
        return String.format(
                "Analysis: %d reports, %d entities, %d proof items, %d attempts in %s. " +
                        "Warnings: %d, Skipped: %d, Errors: %s",
                totalReportsScanned, totalEntities, totalProofItems, totalAttempts,
                analysisTime, warnings.size(), skippedFiles.size(), hadErrors
        );
    }
}
