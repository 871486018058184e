package dev.roshin.proofscanner.analysis.render;

import dev.roshin.proofscanner.analysis.model.AnalysisReport;
import dev.roshin.proofscanner.analysis.model.FileRecommendation;
import dev.roshin.proofscanner.analysis.model.ProverRanking;
import dev.roshin.proofscanner.analysis.model.TimingStats;

import java.util.List;
import java.util.Locale;

/**
 * Renders prover recommendations as plain text, one block per source file.
 */
public class TextReportRenderer {

    static final String EMPTY_MESSAGE = "No proof attempts found.";

    public String render(AnalysisReport report) {
        return render(report.recommendations());
    }

    public String render(List<FileRecommendation> recommendations) {
        if (recommendations.isEmpty()) {
            return EMPTY_MESSAGE + System.lineSeparator();
        }

        StringBuilder out = new StringBuilder();
        for (FileRecommendation file : recommendations) {
            out.append(file.sourceName()).append(System.lineSeparator());
            for (ProverRanking prover : file.provers()) {
                TimingStats t = prover.timings();
                out.append(String.format(Locale.ROOT,
                        "  %-12s success=%.2fs failed=%.2fs max=%.2fs steps=%d%n",
                        prover.prover(), t.successTime(), t.failedTime(), t.maxSuccessTime(), t.maxSteps()));
            }
        }
        return out.toString();
    }
}
