package dev.roshin.proofscanner.analysis.model.tree;

import dev.roshin.proofscanner.analysis.model.enums.NodeKind;

import java.util.List;

/**
 * A provable program unit (subprogram, package elaboration, ...).
 *
 * @param name     Entity name as reported by the prover tool (e.g. "Pkg.Push")
 * @param children Indices of the proof items of this entity
 */
public record EntityNode(
        String name,
        List<Integer> children
) implements ProofNode {

    @Override
    public NodeKind kind() {
        return NodeKind.ENTITY;
    }

    @Override
    public String toString() {
        return String.format("Entity[%s, %d items]", name, children.size());
    }
}
