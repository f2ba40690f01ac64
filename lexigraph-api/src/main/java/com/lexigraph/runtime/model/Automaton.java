/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.runtime.model;

import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.AutomatonStats;
import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * The compiled, queryable representation of a word list: a minimal, acyclic,
 * deterministic automaton whose edges carry one or more letters.
 *
 * <p>Nodes are addressed by integer index and edges refer to their targets by
 * index, never by object reference. The node table uses a compressed sparse
 * row layout: the outgoing edges of node {@code n} occupy edge indices
 * {@code [edgeStart[n], edgeStart[n + 1])}, ordered by the collation rank of
 * each label's first letter.
 *
 * <p>Instances are immutable after {@link Builder#build()} and can be shared by
 * any number of concurrent readers without locking.
 */
public final class Automaton {

    /** Index of the root node. */
    public static final int ROOT = 0;

    private final Alphabet alphabet;

    // --- Node table (indexed by node) ---
    private final boolean[] finals;
    private final int[] edgeStart; // length nodeCount + 1

    // --- Edge table (indexed by edge) ---
    private final String[] labels;
    private final int[] firstRanks; // rank of labels[e].charAt(0)
    private final int[] targets;

    private final AutomatonStats stats;

    private Automaton(Alphabet alphabet, boolean[] finals, int[] edgeStart,
                      String[] labels, int[] firstRanks, int[] targets, AutomatonStats stats) {
        this.alphabet = alphabet;
        this.finals = finals;
        this.edgeStart = edgeStart;
        this.labels = labels;
        this.firstRanks = firstRanks;
        this.targets = targets;
        this.stats = stats;
    }

    public Alphabet getAlphabet() {
        return alphabet;
    }

    public AutomatonStats getStats() {
        return stats;
    }

    public int nodeCount() {
        return finals.length;
    }

    public int edgeCount() {
        return labels.length;
    }

    public boolean isFinal(int node) {
        return finals[node];
    }

    /**
     * @return index of the first outgoing edge of the node
     */
    public int firstEdge(int node) {
        return edgeStart[node];
    }

    /**
     * @return one past the index of the last outgoing edge of the node
     */
    public int endEdge(int node) {
        return edgeStart[node + 1];
    }

    public int outDegree(int node) {
        return edgeStart[node + 1] - edgeStart[node];
    }

    public String label(int edge) {
        return labels[edge];
    }

    public int target(int edge) {
        return targets[edge];
    }

    /**
     * Finds the outgoing edge whose label starts with the given letter.
     *
     * @return the edge index, or -1 if the node has no such edge
     */
    public int findEdge(int node, char letter) {
        int rank = alphabet.rank(letter);
        if (rank < 0) {
            return -1;
        }
        int lo = edgeStart[node];
        int hi = edgeStart[node + 1] - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int r = firstRanks[mid];
            if (r < rank) {
                lo = mid + 1;
            } else if (r > rank) {
                hi = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    /**
     * Walks the word from the root.
     *
     * @return true if the word is accepted
     */
    public boolean contains(CharSequence word) {
        if (word.length() == 0) {
            return false;
        }
        int node = ROOT;
        int i = 0;
        while (i < word.length()) {
            int edge = findEdge(node, word.charAt(i));
            if (edge < 0) {
                return false;
            }
            String label = labels[edge];
            if (word.length() - i < label.length()) {
                return false;
            }
            for (int j = 1; j < label.length(); j++) {
                if (word.charAt(i + j) != label.charAt(j)) {
                    return false;
                }
            }
            i += label.length();
            node = targets[edge];
        }
        return finals[node];
    }

    /**
     * Visits every accepted word in collation order.
     */
    public void forEachWord(Consumer<String> action) {
        visitWords(ROOT, new StringBuilder(), action);
    }

    private void visitWords(int node, StringBuilder prefix, Consumer<String> action) {
        if (finals[node]) {
            action.accept(prefix.toString());
        }
        for (int e = edgeStart[node]; e < edgeStart[node + 1]; e++) {
            int mark = prefix.length();
            prefix.append(labels[e]);
            visitWords(targets[e], prefix, action);
            prefix.setLength(mark);
        }
    }

    /**
     * Incrementally assembles an automaton, one node at a time.
     *
     * <p>Nodes must be added in index order. Each call to {@link #addNode(boolean)}
     * starts a new node; subsequent {@link #addEdge(String, int)} calls attach
     * edges to it, in ascending rank order of their first letters. Target
     * indices may refer to nodes that are added later.
     */
    public static class Builder {
        private final Alphabet alphabet;
        private final BooleanArrayList finals = new BooleanArrayList();
        private final IntArrayList edgeStart = new IntArrayList();
        private final ObjectArrayList<String> labels = new ObjectArrayList<>();
        private final IntArrayList targets = new IntArrayList();

        public Builder(Alphabet alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet must not be null");
        }

        /**
         * Starts the next node.
         *
         * @return the index of the new node
         */
        public int addNode(boolean isFinal) {
            int id = finals.size();
            finals.add(isFinal);
            edgeStart.add(labels.size());
            return id;
        }

        /**
         * Adds an outgoing edge to the most recently added node.
         */
        public Builder addEdge(String label, int target) {
            if (finals.isEmpty()) {
                throw new IllegalStateException("addNode must be called before addEdge");
            }
            labels.add(Objects.requireNonNull(label, "label must not be null"));
            targets.add(target);
            return this;
        }

        /**
         * Validates the invariants and freezes the automaton.
         *
         * @throws IllegalStateException if a label is empty or foreign, a target
         *                               is out of range, sibling edges are not in
         *                               strictly ascending first-letter order, or
         *                               the graph contains a cycle
         */
        public Automaton build() {
            if (finals.isEmpty()) {
                addNode(false);
            }
            int nodeCount = finals.size();
            int edgeCount = labels.size();

            int[] starts = new int[nodeCount + 1];
            for (int n = 0; n < nodeCount; n++) {
                starts[n] = edgeStart.getInt(n);
            }
            starts[nodeCount] = edgeCount;

            String[] labelArray = labels.toArray(new String[0]);
            int[] targetArray = targets.toIntArray();
            int[] ranks = new int[edgeCount];

            validateEdges(nodeCount, starts, labelArray, targetArray, ranks);
            boolean[] finalArray = finals.toBooleanArray();
            int[] postOrder = topologicalOrder(nodeCount, starts, targetArray);
            AutomatonStats stats = computeStats(finalArray, starts, labelArray, targetArray, postOrder);

            return new Automaton(alphabet, finalArray, starts, labelArray, ranks, targetArray, stats);
        }

        private void validateEdges(int nodeCount, int[] starts, String[] labelArray, int[] targetArray, int[] ranks) {
            for (int n = 0; n < nodeCount; n++) {
                int previousRank = -1;
                for (int e = starts[n]; e < starts[n + 1]; e++) {
                    String label = labelArray[e];
                    if (label.isEmpty()) {
                        throw new IllegalStateException("Node " + n + " has an edge with an empty label");
                    }
                    int foreign = alphabet.indexOfForeign(label);
                    if (foreign >= 0) {
                        throw new IllegalStateException("Node " + n + " has edge '" + label + "' with letter '"
                                + label.charAt(foreign) + "' outside alphabet '" + alphabet.name() + "'");
                    }
                    int target = targetArray[e];
                    if (target < 0 || target >= nodeCount) {
                        throw new IllegalStateException("Node " + n + " has edge '" + label
                                + "' to unknown node " + target);
                    }
                    int rank = alphabet.rank(label.charAt(0));
                    if (rank <= previousRank) {
                        throw new IllegalStateException("Node " + n + " has edges out of order or sharing first letter '"
                                + label.charAt(0) + "'");
                    }
                    ranks[e] = rank;
                    previousRank = rank;
                }
            }
        }

        /**
         * Iterative depth-first search over every node.
         *
         * @return all nodes in post-order (children before parents)
         */
        private static int[] topologicalOrder(int nodeCount, int[] starts, int[] targetArray) {
            final byte unvisited = 0, onStack = 1, done = 2;
            byte[] state = new byte[nodeCount];
            int[] order = new int[nodeCount];
            int ordered = 0;
            int[] stackNode = new int[nodeCount];
            int[] stackEdge = new int[nodeCount];

            for (int start = 0; start < nodeCount; start++) {
                if (state[start] != unvisited) continue;
                int depth = 0;
                stackNode[0] = start;
                stackEdge[0] = starts[start];
                state[start] = onStack;
                while (depth >= 0) {
                    int node = stackNode[depth];
                    int edge = stackEdge[depth];
                    if (edge < starts[node + 1]) {
                        stackEdge[depth] = edge + 1;
                        int child = targetArray[edge];
                        if (state[child] == onStack) {
                            throw new IllegalStateException("Cycle detected: edge from node " + node
                                    + " returns to node " + child);
                        }
                        if (state[child] == unvisited) {
                            state[child] = onStack;
                            depth++;
                            stackNode[depth] = child;
                            stackEdge[depth] = starts[child];
                        }
                    } else {
                        state[node] = done;
                        order[ordered++] = node;
                        depth--;
                    }
                }
            }
            return order;
        }

        private static AutomatonStats computeStats(boolean[] finalArray, int[] starts, String[] labelArray,
                                                   int[] targetArray, int[] postOrder) {
            int nodeCount = finalArray.length;
            long[] words = new long[nodeCount];
            int[] longest = new int[nodeCount]; // -1 when no word is reachable
            for (int node : postOrder) {
                long count = finalArray[node] ? 1 : 0;
                int best = finalArray[node] ? 0 : -1;
                for (int e = starts[node]; e < starts[node + 1]; e++) {
                    int child = targetArray[e];
                    count += words[child];
                    if (longest[child] >= 0) {
                        best = Math.max(best, labelArray[e].length() + longest[child]);
                    }
                }
                words[node] = count;
                longest[node] = best;
            }
            long labelChars = 0;
            for (String label : labelArray) {
                labelChars += label.length();
            }
            return new AutomatonStats(nodeCount, labelArray.length, labelChars,
                    words[ROOT], Math.max(0, longest[ROOT]));
        }
    }
}
