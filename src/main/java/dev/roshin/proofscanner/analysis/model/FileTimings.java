package dev.roshin.proofscanner.analysis.model;

import java.util.Map;

/**
 * Aggregated timings of all provers observed for one logical source file.
 *
 * @param sourceName Representative source file name chosen among all spellings seen
 * @param provers    Prover identity to its accumulated timings
 */
public record FileTimings(
        String sourceName,
        Map<String, TimingStats> provers
) {
}
