package com.lexigraph.compiler;

import com.lexigraph.api.model.Alphabet;
import com.lexigraph.runtime.model.Automaton;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Final pass over a collapsed arena: merges any structurally identical states,
 * renumbers the reachable nodes and freezes the result.
 *
 * <p>Numbering is depth-first preorder from the root with edges visited in
 * collation order, so the root is node 0 and the numbering depends only on the
 * accepted language. This is what makes serialized output reproducible.
 */
final class StateCanonicalizer {

    private static final Logger logger = Logger.getLogger(StateCanonicalizer.class.getName());

    private int mergedStates;

    Automaton canonicalize(NodeArena arena, int root, Alphabet alphabet) {
        int capacity = arena.capacity();
        IntArrayList postOrder = new IntArrayList();
        collectPostOrder(arena, root, new boolean[capacity], postOrder);

        int[] canonical = new int[capacity];
        Arrays.fill(canonical, -1);
        Object2IntOpenHashMap<StateSignature> register = new Object2IntOpenHashMap<>(postOrder.size());
        register.defaultReturnValue(-1);
        for (int i = 0; i < postOrder.size(); i++) {
            int node = postOrder.getInt(i);
            StateSignature signature = StateSignature.of(arena, node, target -> canonical[target]);
            int existing = register.getInt(signature);
            if (existing >= 0) {
                canonical[node] = existing;
                mergedStates++;
            } else {
                register.put(signature, node);
                canonical[node] = node;
            }
        }
        if (mergedStates > 0) {
            logger.warning("Merged " + mergedStates + " duplicate states after collapsing");
        }

        int[] newIds = new int[capacity];
        Arrays.fill(newIds, -1);
        IntArrayList order = new IntArrayList(register.size());
        number(arena, canonical[root], canonical, newIds, order);

        Automaton.Builder builder = new Automaton.Builder(alphabet);
        for (int i = 0; i < order.size(); i++) {
            int node = order.getInt(i);
            builder.addNode(arena.isFinal(node));
            for (int e = 0; e < arena.outDegree(node); e++) {
                builder.addEdge(arena.label(node, e), newIds[canonical[arena.target(node, e)]]);
            }
        }
        return builder.build();
    }

    /**
     * @return duplicate states merged by the last call; 0 for a correctly minimized input
     */
    int mergedStates() {
        return mergedStates;
    }

    // Recursion depth is bounded by the longest word.
    private static void collectPostOrder(NodeArena arena, int node, boolean[] visited, IntArrayList out) {
        visited[node] = true;
        for (int e = 0; e < arena.outDegree(node); e++) {
            int target = arena.target(node, e);
            if (!visited[target]) {
                collectPostOrder(arena, target, visited, out);
            }
        }
        out.add(node);
    }

    private static void number(NodeArena arena, int node, int[] canonical, int[] newIds, IntArrayList order) {
        newIds[node] = order.size();
        order.add(node);
        for (int e = 0; e < arena.outDegree(node); e++) {
            int target = canonical[arena.target(node, e)];
            if (newIds[target] < 0) {
                number(arena, target, canonical, newIds, order);
            }
        }
    }
}
