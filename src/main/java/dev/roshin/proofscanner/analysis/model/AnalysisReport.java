package dev.roshin.proofscanner.analysis.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * The complete output of a proof timing analysis run.
 *
 * @param reportRoot        The directory the prover reports were collected from
 * @param analysisTimestamp When the analysis was performed
 * @param recommendations   Suggested prover order per source file, sorted by file name
 * @param metadata          Statistics, warnings, and diagnostic information
 */
public record AnalysisReport(
        Path reportRoot,
        LocalDateTime analysisTimestamp,
        List<FileRecommendation> recommendations,
        AnalysisMetadata metadata
) {
    @Override
    public String toString() {
        return String.format(
                "AnalysisReport[root=%s, timestamp=%s, %d files]",
                reportRoot.getFileName(), analysisTimestamp, recommendations.size()
        );
    }
}
