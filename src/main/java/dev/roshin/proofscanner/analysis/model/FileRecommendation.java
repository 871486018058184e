package dev.roshin.proofscanner.analysis.model;

import java.util.List;

/**
 * Suggested prover order for one source file.
 *
 * @param sourceName Canonical source file name
 * @param provers    Provers to try, best first
 */
public record FileRecommendation(
        String sourceName,
        List<ProverRanking> provers
) {
    @Override
    public String toString() {
        return String.format("%s: %s", sourceName, provers);
    }
}
