package com.lexigraph.compiler;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Comparator;

/**
 * Builds a minimal acyclic automaton from words supplied in strictly ascending
 * collation order, without ever materializing the full trie.
 *
 * <p>Only the path of the most recently added word is mutable. When the next
 * word diverges from it at position {@code p}, every path node deeper than
 * {@code p} is frozen: it is either replaced by an equivalent node already in
 * the register or registered itself. Replaced nodes return to the arena's free
 * list.
 *
 * <p>The register lives in this instance; one minimizer serves exactly one
 * build.
 */
final class IncrementalMinimizer {

    private final NodeArena arena = new NodeArena();
    private final Object2IntOpenHashMap<StateSignature> register = new Object2IntOpenHashMap<>();
    private final Comparator<String> collator;
    private final int root;

    /** path.getInt(i) is the node reached after the first i letters of the previous word. */
    private final IntArrayList path = new IntArrayList();
    private String previous = "";
    private int wordCount;
    private int mergedNodes;
    private boolean finished;

    IncrementalMinimizer(Comparator<String> collator) {
        this.collator = collator;
        this.register.defaultReturnValue(-1);
        this.root = arena.allocate();
        this.path.add(root);
    }

    /**
     * @throws IllegalArgumentException if the word is empty or does not sort
     *                                  strictly after the previous word
     */
    void add(String word) {
        if (finished) {
            throw new IllegalStateException("Minimizer is already finished");
        }
        if (word.isEmpty()) {
            throw new IllegalArgumentException("Words must not be empty");
        }
        if (wordCount > 0 && collator.compare(word, previous) <= 0) {
            throw new IllegalArgumentException("Words must be added in strictly ascending order: '"
                    + word + "' after '" + previous + "'");
        }

        int common = commonPrefixLength(previous, word);
        freezeBelow(common);

        int node = path.getInt(common);
        for (int i = common; i < word.length(); i++) {
            int child = arena.allocate();
            arena.addEdge(node, String.valueOf(word.charAt(i)), child);
            path.add(child);
            node = child;
        }
        arena.setFinal(node, true);

        previous = word;
        wordCount++;
    }

    /**
     * Freezes the remaining path.
     *
     * @return the arena holding the minimal automaton, rooted at {@link #root()}
     */
    NodeArena finish() {
        if (!finished) {
            freezeBelow(0);
            finished = true;
        }
        return arena;
    }

    int root() {
        return root;
    }

    int wordCount() {
        return wordCount;
    }

    int mergedNodes() {
        return mergedNodes;
    }

    int registerSize() {
        return register.size();
    }

    private void freezeBelow(int depth) {
        for (int i = path.size() - 1; i > depth; i--) {
            int child = path.getInt(i);
            int parent = path.getInt(i - 1);
            StateSignature signature = StateSignature.of(arena, child);
            int existing = register.getInt(signature);
            if (existing >= 0) {
                // child is always the target of the parent's newest edge
                arena.setTarget(parent, arena.outDegree(parent) - 1, existing);
                arena.free(child);
                mergedNodes++;
            } else {
                register.put(signature, child);
            }
            path.removeInt(i);
        }
    }

    private static int commonPrefixLength(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }
}
