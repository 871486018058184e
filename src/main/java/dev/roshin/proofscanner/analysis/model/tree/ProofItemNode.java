package dev.roshin.proofscanner.analysis.model.tree;

import dev.roshin.proofscanner.analysis.model.enums.NodeKind;

import java.util.List;

/**
 * One verification condition of an entity.
 *
 * @param parent     Index of the owning entity
 * @param unit       Logical source file this item is accounted to (report unit name)
 * @param sourceFile Source file spelling given for the item (e.g. "pkg.ads", "pkg-child.adb")
 * @param rule       Check rule (e.g. "VC_OVERFLOW_CHECK"), empty if not reported
 * @param line       Line number in the source file, 0 if not reported
 * @param children   Indices of the proof attempts, in invocation order
 */
public record ProofItemNode(
        int parent,
        String unit,
        String sourceFile,
        String rule,
        int line,
        List<Integer> children
) implements ProofNode {

    @Override
    public NodeKind kind() {
        return NodeKind.PROOF_ITEM;
    }

    @Override
    public String toString() {
        return String.format("ProofItem[%s:%d %s, %d attempts]", sourceFile, line, rule, children.size());
    }
}
