package dev.roshin.proofscanner.analysis.model;

/**
 * One prover entry of a file recommendation.
 *
 * @param prover  Prover identity
 * @param timings Accumulated timings of the prover on the file
 */
public record ProverRanking(
        String prover,
        TimingStats timings
) {
    public double successTime() {
        return timings.successTime();
    }

    public double failedTime() {
        return timings.failedTime();
    }

    @Override
    public String toString() {
        return String.format("%s(%s)", prover, timings);
    }
}
