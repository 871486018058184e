package dev.roshin.proofscanner.analysis.model.enums;

/**
 * Result reported by a prover for a single proof attempt.
 * Only {@link #VALID} counts as a success; every other value is a failure.
 */
public enum AttemptOutcome {
    /**
     * The prover discharged the obligation
     */
    VALID,

    /**
     * The prover found a counterexample
     */
    INVALID,

    /**
     * The prover ran out of time or steps
     */
    TIMEOUT,

    /**
     * The prover gave up without an answer
     */
    UNKNOWN,

    /**
     * Anything else a report may contain (errors, out of memory, ...)
     */
    OTHER;

    public boolean isValid() {
        return this == VALID;
    }

    /**
     * Maps report text to an outcome. Only the exact spellings "Valid", "Invalid",
     * "Timeout" and "Unknown" are recognised; anything else becomes {@link #OTHER}.
     */
    public static AttemptOutcome parse(String raw) {
        if (raw == null) {
            return OTHER;
        }
        switch (raw) {
            case "Valid":
                return VALID;
            case "Invalid":
                return INVALID;
            case "Timeout":
                return TIMEOUT;
            case "Unknown":
                return UNKNOWN;
            default:
                return OTHER;
        }
    }
}
