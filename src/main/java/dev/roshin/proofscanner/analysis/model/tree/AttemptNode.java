package dev.roshin.proofscanner.analysis.model.tree;

import dev.roshin.proofscanner.analysis.model.enums.AttemptOutcome;
import dev.roshin.proofscanner.analysis.model.enums.NodeKind;

import java.util.List;

/**
 * A single prover invocation against a proof item.
 *
 * @param parent      Index of the owning proof item
 * @param prover      Prover identity (e.g. "CVC4", "Z3", "altergo", "Trivial")
 * @param outcome     Reported result
 * @param timeSeconds Elapsed time in seconds, never negative
 * @param steps       Raw prover-reported step count, never negative
 */
public record AttemptNode(
        int parent,
        String prover,
        AttemptOutcome outcome,
        double timeSeconds,
        long steps
) implements ProofNode {

    @Override
    public NodeKind kind() {
        return NodeKind.ATTEMPT;
    }

    @Override
    public List<Integer> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return String.format("Attempt[%s %s, %.2fs, %d steps]", prover, outcome, timeSeconds, steps);
    }
}
