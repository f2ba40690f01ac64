package com.lexigraph.compiler;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Arrays;

/**
 * Folds chains of pass-through nodes into multi-letter edges.
 *
 * <p>A node is folded into its incoming edge when it is not final, has exactly
 * one outgoing edge and exactly one incoming edge. Folding never changes the
 * accepted language. It must run after minimization: merging first maximizes
 * sharing, and a shared node (in-degree above one) is never folded.
 */
final class ChainCollapser {

    private int foldedNodes;
    private int multiLetterEdges;

    /**
     * Collapses the arena in place.
     *
     * @return number of nodes folded away
     */
    int collapse(NodeArena arena, int root) {
        int[] inDegree = new int[arena.capacity()];
        boolean[] visited = new boolean[arena.capacity()];
        IntArrayList stack = new IntArrayList();

        stack.push(root);
        visited[root] = true;
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            for (int e = 0; e < arena.outDegree(node); e++) {
                int target = arena.target(node, e);
                inDegree[target]++;
                if (!visited[target]) {
                    visited[target] = true;
                    stack.push(target);
                }
            }
        }

        Arrays.fill(visited, false);
        stack.push(root);
        visited[root] = true;
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            for (int e = 0; e < arena.outDegree(node); e++) {
                int target = arena.target(node, e);
                if (isPassThrough(arena, target, inDegree)) {
                    StringBuilder label = new StringBuilder(arena.label(node, e));
                    while (isPassThrough(arena, target, inDegree)) {
                        label.append(arena.label(target, 0));
                        int next = arena.target(target, 0);
                        arena.free(target);
                        foldedNodes++;
                        target = next;
                    }
                    arena.setEdge(node, e, label.toString(), target);
                    multiLetterEdges++;
                }
                if (!visited[target]) {
                    visited[target] = true;
                    stack.push(target);
                }
            }
        }
        return foldedNodes;
    }

    int foldedNodes() {
        return foldedNodes;
    }

    int multiLetterEdges() {
        return multiLetterEdges;
    }

    private static boolean isPassThrough(NodeArena arena, int node, int[] inDegree) {
        return !arena.isFinal(node) && arena.outDegree(node) == 1 && inDegree[node] == 1;
    }
}
