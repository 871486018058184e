package dev.roshin.proofscanner.analysis.config;

/**
 * Configuration parameters for the proof timing analysis.
 *
 * @param reportExtension   File name suffix identifying prover reports (e.g. ".spark")
 * @param maxProversPerFile Maximum number of ranked provers kept per source file.
 *                          Default: -1 for unlimited
 */
public record AnalysisConfig(
        String reportExtension,
        int maxProversPerFile
) {
    public static final String SPARK_EXTENSION = ".spark";

    /**
     * Default configuration: ".spark" reports, every observed prover ranked.
     */
    public static final AnalysisConfig DEFAULT = new AnalysisConfig(SPARK_EXTENSION, -1);

    /**
     * Creates a config with validation.
     */
    public AnalysisConfig {
        if (reportExtension == null || reportExtension.isBlank()) {
            throw new IllegalArgumentException("reportExtension must not be blank");
        }
        if (maxProversPerFile < -1 || maxProversPerFile == 0) {
            throw new IllegalArgumentException(
                    "maxProversPerFile must be positive or -1 for unlimited, got: " + maxProversPerFile
            );
        }
    }

    /**
     * Creates a default config keeping at most the given number of provers per file.
     */
    public static AnalysisConfig withMaxProvers(int maxProvers) {
        return new AnalysisConfig(SPARK_EXTENSION, maxProvers);
    }

    /**
     * Returns true if every ranked prover is kept.
     */
    public boolean isUnlimited() {
        return maxProversPerFile == -1;
    }
}
