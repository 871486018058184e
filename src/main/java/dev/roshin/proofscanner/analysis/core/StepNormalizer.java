package dev.roshin.proofscanner.analysis.core;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Rescales raw prover step counts onto a roughly common scale.
 * <p>
 * CVC4 and Z3 report steps with a large fixed offset and a much finer
 * granularity than the other provers, so both are shifted and divided.
 * The result is always at least 1: a prover that ran and reported 0 steps
 * is distinguishable from one that never ran.
 */
public final class StepNormalizer {

    private static final String CVC4_PREFIX = "CVC4";
    private static final long CVC4_OFFSET = 15_000L;
    private static final long CVC4_FACTOR = 35L;

    private static final String Z3_PREFIX = "Z3";
    private static final long Z3_OFFSET = 450_000L;
    private static final long Z3_FACTOR = 800L;

    private StepNormalizer() {
    }

    /**
     * @param prover   Prover identity as reported
     * @param rawSteps Reported step count, must not be negative
     * @return normalized step count, at least 1
     */
    public static long normalize(String prover, long rawSteps) {
        checkArgument(rawSteps >= 0, "raw steps must be non-negative, got %s", rawSteps);

        if (prover.startsWith(CVC4_PREFIX)) {
            return Math.max(rawSteps - CVC4_OFFSET, 0L) / CVC4_FACTOR + 1;
        }
        if (prover.startsWith(Z3_PREFIX)) {
            return Math.max(rawSteps - Z3_OFFSET, 0L) / Z3_FACTOR + 1;
        }
        return rawSteps + 1;
    }
}
