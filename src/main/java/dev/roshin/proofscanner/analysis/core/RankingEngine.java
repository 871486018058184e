package dev.roshin.proofscanner.analysis.core;

import dev.roshin.proofscanner.analysis.config.AnalysisConfig;
import dev.roshin.proofscanner.analysis.model.FileRecommendation;
import dev.roshin.proofscanner.analysis.model.FileTimings;
import dev.roshin.proofscanner.analysis.model.ProverRanking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns aggregated timings into a suggested prover order per source file.
 * <p>
 * The ranking is a heuristic over the attempts that were actually made: provers
 * skipped for an obligation because an earlier prover already proved it leave
 * no trace, and files are ranked independently of each other.
 */
public class RankingEngine {
    private static final Logger log = LoggerFactory.getLogger(RankingEngine.class);

    /**
     * Pseudo-prover for obligations discharged without any real prover.
     */
    public static final String TRIVIAL_PROVER = "Trivial";

    /**
     * Least failed time first; on equal failed time, most success time first.
     */
    public static final Comparator<ProverRanking> PROVER_ORDER =
            Comparator.comparingDouble(ProverRanking::failedTime)
                    .thenComparing(Comparator.comparingDouble(ProverRanking::successTime).reversed());

    public static final Comparator<FileRecommendation> FILE_ORDER =
            Comparator.comparing(FileRecommendation::sourceName);

    private final AnalysisConfig config;

    public RankingEngine(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Ranks the provers of every file and orders the files by canonical name.
     * Files without any prover other than {@value #TRIVIAL_PROVER} are left out.
     *
     * @param timings Aggregator output, file key to timings
     * @return recommendations sorted by source name
     */
    public List<FileRecommendation> rank(Map<String, FileTimings> timings) {
        List<FileRecommendation> files = new ArrayList<>();

        for (Map.Entry<String, FileTimings> entry : timings.entrySet()) {
            FileTimings fileTimings = entry.getValue();
            List<ProverRanking> provers = new ArrayList<>();

            fileTimings.provers().forEach((prover, stats) -> {
                if (!TRIVIAL_PROVER.equals(prover)) {
                    provers.add(new ProverRanking(prover, stats));
                }
            });

            if (provers.isEmpty()) {
                log.debug("Skipping {}: no provers besides {}", entry.getKey(), TRIVIAL_PROVER);
                continue;
            }

            provers.sort(PROVER_ORDER);
            List<ProverRanking> kept = config.isUnlimited() || provers.size() <= config.maxProversPerFile()
                    ? provers
                    : provers.subList(0, config.maxProversPerFile());

            files.add(new FileRecommendation(fileTimings.sourceName(), List.copyOf(kept)));
        }

        files.sort(FILE_ORDER);
        log.debug("Ranked provers for {} of {} files", files.size(), timings.size());
        return List.copyOf(files);
    }
}
