package dev.roshin.proofscanner.analysis.model.enums;

/**
 * Kind tag carried by every node of a proof tree.
 */
public enum NodeKind {
    ENTITY,
    PROOF_ITEM,
    ATTEMPT
}
