package com.lexigraph.compiler;

import java.util.Arrays;
import java.util.function.IntUnaryOperator;

/**
 * Structural identity of a node: its final flag and its outgoing
 * (label, target) pairs in edge order. Two nodes with equal signatures accept
 * the same suffix language once their targets are canonical.
 */
final class StateSignature {

    private final boolean isFinal;
    private final String[] labels;
    private final int[] targets;
    private final int hash;

    private StateSignature(boolean isFinal, String[] labels, int[] targets) {
        this.isFinal = isFinal;
        this.labels = labels;
        this.targets = targets;
        int h = isFinal ? 1 : 0;
        h = 31 * h + Arrays.hashCode(labels);
        h = 31 * h + Arrays.hashCode(targets);
        this.hash = h;
    }

    static StateSignature of(NodeArena arena, int node) {
        return of(arena, node, IntUnaryOperator.identity());
    }

    /**
     * @param targetMap maps each edge target to the id it should be compared by
     */
    static StateSignature of(NodeArena arena, int node, IntUnaryOperator targetMap) {
        int degree = arena.outDegree(node);
        String[] labels = new String[degree];
        int[] targets = new int[degree];
        for (int e = 0; e < degree; e++) {
            labels[e] = arena.label(node, e);
            targets[e] = targetMap.applyAsInt(arena.target(node, e));
        }
        return new StateSignature(arena.isFinal(node), labels, targets);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSignature)) return false;
        StateSignature other = (StateSignature) o;
        return hash == other.hash
                && isFinal == other.isFinal
                && Arrays.equals(targets, other.targets)
                && Arrays.equals(labels, other.labels);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
