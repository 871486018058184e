package dev.roshin.proofscanner.analysis.core;

import com.google.common.collect.ImmutableSortedMap;
import dev.roshin.proofscanner.analysis.model.FileTimings;
import dev.roshin.proofscanner.analysis.model.TimingStats;
import dev.roshin.proofscanner.analysis.model.tree.AttemptNode;
import dev.roshin.proofscanner.analysis.model.tree.ProofItemNode;
import dev.roshin.proofscanner.analysis.model.tree.ProofTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Walks a proof tree once and accumulates, per source file and prover, the time
 * spent in successful and failed attempts.
 * <p>
 * All state lives in the maps of a single {@link #aggregate(ProofTree)} call.
 */
public class TimingAggregator {
    private static final Logger log = LoggerFactory.getLogger(TimingAggregator.class);

    /**
     * Aggregates all attempts of the tree.
     *
     * @param tree Fully built proof tree
     * @return file key to the resolved source name and per-prover timings, sorted by file key
     */
    public Map<String, FileTimings> aggregate(ProofTree tree) {
        Map<String, Map<String, TimingStats>> timings = new TreeMap<>();
        Map<String, String> sourceNames = new TreeMap<>();
        int attempts = 0;

        for (int entity : tree.entities()) {
            for (int itemIndex : tree.children(entity)) {
                ProofItemNode item = tree.proofItem(itemIndex);
                String fileKey = item.unit();

                sourceNames.put(fileKey,
                        SourceNameResolver.resolve(sourceNames.get(fileKey), item.sourceFile()));
                Map<String, TimingStats> provers = timings.computeIfAbsent(fileKey, k -> new TreeMap<>());

                for (int attemptIndex : tree.children(itemIndex)) {
                    AttemptNode attempt = tree.attempt(attemptIndex);
                    TimingStats current = provers.getOrDefault(attempt.prover(), TimingStats.ZERO);
                    provers.put(attempt.prover(), record(current, attempt));
                    attempts++;
                }
            }
        }

        Map<String, FileTimings> result = new TreeMap<>();
        timings.forEach((fileKey, provers) ->
                result.put(fileKey, new FileTimings(sourceNames.get(fileKey), ImmutableSortedMap.copyOf(provers))));

        log.debug("Aggregated {} attempts into {} files", attempts, result.size());
        return result;
    }

    private static TimingStats record(TimingStats current, AttemptNode attempt) {
        if (attempt.outcome().isValid()) {
            return current.plusSuccess(attempt.timeSeconds(),
                    StepNormalizer.normalize(attempt.prover(), attempt.steps()));
        }
        return current.plusFailure(attempt.timeSeconds());
    }
}
