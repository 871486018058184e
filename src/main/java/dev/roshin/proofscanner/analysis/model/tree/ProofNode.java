package dev.roshin.proofscanner.analysis.model.tree;

import dev.roshin.proofscanner.analysis.model.enums.NodeKind;

import java.util.List;

/**
 * A node of a {@link ProofTree}. The set of node kinds is closed.
 */
public sealed interface ProofNode permits EntityNode, ProofItemNode, AttemptNode {

    NodeKind kind();

    /**
     * Indices of the direct children, in insertion order. Attempts are leaves.
     */
    List<Integer> children();
}
