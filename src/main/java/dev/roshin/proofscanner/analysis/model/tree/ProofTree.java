package dev.roshin.proofscanner.analysis.model.tree;

import dev.roshin.proofscanner.analysis.model.enums.AttemptOutcome;
import dev.roshin.proofscanner.analysis.model.enums.NodeKind;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable arena holding entities, their proof items and the proof attempts of each item.
 * Nodes are addressed by stable integer indices; every node has exactly one parent
 * (entities hang off the tree root).
 * <p>
 * Trees are created through {@link Builder} and only traversed afterwards.
 */
public final class ProofTree {

    private final List<ProofNode> nodes;
    private final List<Integer> entities;

    private ProofTree(List<ProofNode> nodes, List<Integer> entities) {
        this.nodes = nodes;
        this.entities = entities;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns an empty tree.
     */
    public static ProofTree empty() {
        return builder().build();
    }

    /**
     * Indices of all entities, in insertion order.
     */
    public List<Integer> entities() {
        return entities;
    }

    /**
     * Indices of the direct children of the given node, in insertion order.
     */
    public List<Integer> children(int index) {
        return node(index).children();
    }

    public ProofNode node(int index) {
        checkElementIndex(index, nodes.size(), "node index");
        return nodes.get(index);
    }

    public EntityNode entity(int index) {
        if (node(index) instanceof EntityNode entity) {
            return entity;
        }
        throw kindMismatch(index, NodeKind.ENTITY);
    }

    public ProofItemNode proofItem(int index) {
        if (node(index) instanceof ProofItemNode item) {
            return item;
        }
        throw kindMismatch(index, NodeKind.PROOF_ITEM);
    }

    public AttemptNode attempt(int index) {
        if (node(index) instanceof AttemptNode attempt) {
            return attempt;
        }
        throw kindMismatch(index, NodeKind.ATTEMPT);
    }

    /**
     * Total number of nodes of all kinds.
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Number of nodes of the given kind.
     */
    public int count(NodeKind kind) {
        return (int) nodes.stream().filter(n -> n.kind() == kind).count();
    }

    /**
     * Whether an attempt with the given time and step count can be added to a tree.
     * NaN times are rejected.
     */
    public static boolean isValidMeasurement(double timeSeconds, long steps) {
        return timeSeconds >= 0.0 && steps >= 0;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    private IllegalStateException kindMismatch(int index, NodeKind expected) {
        return new IllegalStateException(String.format(
                "Node %d is a %s, expected %s", index, nodes.get(index).kind(), expected));
    }

    @Override
    public String toString() {
        return String.format("ProofTree[%d entities, %d items, %d attempts]",
                entities.size(), count(NodeKind.PROOF_ITEM), count(NodeKind.ATTEMPT));
    }

    /**
     * Mutable builder for a {@link ProofTree}. Children can only be attached to a
     * parent of the matching kind, so the resulting tree is always well formed.
     */
    public static final class Builder {
        private final List<PendingNode> pending = new ArrayList<>();
        private final List<Integer> entities = new ArrayList<>();

        private Builder() {
        }

        public int addEntity(String name) {
            checkNotNull(name, "entity name");
            int index = add(new PendingNode(NodeKind.ENTITY, -1, name, null, null, 0, null, null, 0.0, 0L));
            entities.add(index);
            return index;
        }

        public int addProofItem(int entity, String unit, String sourceFile, String rule, int line) {
            checkParent(entity, NodeKind.ENTITY);
            checkNotNull(unit, "unit");
            checkNotNull(sourceFile, "sourceFile");
            int index = add(new PendingNode(NodeKind.PROOF_ITEM, entity, null, unit, sourceFile, line,
                    rule == null ? "" : rule, null, 0.0, 0L));
            pending.get(entity).children.add(index);
            return index;
        }

        public int addAttempt(int proofItem, String prover, AttemptOutcome outcome, double timeSeconds, long steps) {
            checkParent(proofItem, NodeKind.PROOF_ITEM);
            checkNotNull(prover, "prover");
            checkNotNull(outcome, "outcome");
            checkArgument(isValidMeasurement(timeSeconds, steps),
                    "time and steps must be non-negative numbers, got %s s and %s steps", timeSeconds, (Object) steps);
            int index = add(new PendingNode(NodeKind.ATTEMPT, proofItem, prover, null, null, 0, null,
                    outcome, timeSeconds, steps));
            pending.get(proofItem).children.add(index);
            return index;
        }

        public ProofTree build() {
            List<ProofNode> nodes = new ArrayList<>(pending.size());
            for (PendingNode p : pending) {
                nodes.add(p.freeze());
            }
            return new ProofTree(List.copyOf(nodes), List.copyOf(entities));
        }

        private int add(PendingNode node) {
            pending.add(node);
            return pending.size() - 1;
        }

        private void checkParent(int parent, NodeKind expected) {
            checkArgument(parent >= 0 && parent < pending.size(), "Unknown parent index %s", parent);
            NodeKind actual = pending.get(parent).kind;
            checkArgument(actual == expected, "Parent %s is a %s, expected %s", parent, actual, expected);
        }
    }

    private static final class PendingNode {
        final NodeKind kind;
        final int parent;
        final String name;
        final String unit;
        final String sourceFile;
        final int line;
        final String rule;
        final AttemptOutcome outcome;
        final double timeSeconds;
        final long steps;
        final List<Integer> children = new ArrayList<>();

        PendingNode(NodeKind kind, int parent, String name, String unit, String sourceFile, int line,
                    String rule, AttemptOutcome outcome, double timeSeconds, long steps) {
            this.kind = kind;
            this.parent = parent;
            this.name = name;
            this.unit = unit;
            this.sourceFile = sourceFile;
            this.line = line;
            this.rule = rule;
            this.outcome = outcome;
            this.timeSeconds = timeSeconds;
            this.steps = steps;
        }

        ProofNode freeze() {
            switch (kind) {
                case ENTITY:
                    return new EntityNode(name, List.copyOf(children));
                case PROOF_ITEM:
                    return new ProofItemNode(parent, unit, sourceFile, rule, line, List.copyOf(children));
                case ATTEMPT:
                    return new AttemptNode(parent, name, outcome, timeSeconds, steps);
                default:
                    throw new IllegalStateException("Unhandled node kind: " + kind);
            }
        }
    }
}
