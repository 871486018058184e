package dev.roshin.proofscanner.analysis.model;

/**
 * Accumulated timing of one prover on one source file.
 * Instances are immutable; each recorded attempt yields a new value.
 *
 * @param successTime    Total seconds spent in attempts that ended Valid
 * @param failedTime     Total seconds spent in attempts with any other outcome
 * @param maxSuccessTime Longest single Valid attempt, in seconds
 * @param maxSteps       Largest normalized step count among Valid attempts
 */
public record TimingStats(
        double successTime,
        double failedTime,
        double maxSuccessTime,
        long maxSteps
) {
    public static final TimingStats ZERO = new TimingStats(0.0, 0.0, 0.0, 0L);

    /**
     * Accounts a successful attempt.
     */
    public TimingStats plusSuccess(double time, long normalizedSteps) {
        return new TimingStats(
                successTime + time,
                failedTime,
                Math.max(maxSuccessTime, time),
                Math.max(maxSteps, normalizedSteps)
        );
    }

    /**
     * Accounts a failed attempt. Failures never touch the maxima.
     */
    public TimingStats plusFailure(double time) {
        return new TimingStats(successTime, failedTime + time, maxSuccessTime, maxSteps);
    }

    @Override
    public String toString() {
        return String.format("success=%.2fs, failed=%.2fs, maxSuccess=%.2fs, maxSteps=%d",
                successTime, failedTime, maxSuccessTime, maxSteps);
    }
}
