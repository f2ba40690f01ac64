package com.lexigraph.compiler;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Mutable node table used while a build is in progress.
 *
 * <p>Nodes are integer slots; edges refer to their targets by slot. Freed slots
 * are recycled, so the table stays proportional to the number of distinct
 * states rather than the number of nodes ever created.
 */
final class NodeArena {

    private final BooleanArrayList finals = new BooleanArrayList();
    private final ObjectArrayList<ObjectArrayList<String>> labels = new ObjectArrayList<>();
    private final ObjectArrayList<IntArrayList> targets = new ObjectArrayList<>();
    private final IntArrayList freeList = new IntArrayList();
    private int liveCount;
    private long allocations;

    int allocate() {
        allocations++;
        liveCount++;
        if (!freeList.isEmpty()) {
            return freeList.popInt();
        }
        finals.add(false);
        labels.add(new ObjectArrayList<>(2));
        targets.add(new IntArrayList(2));
        return finals.size() - 1;
    }

    void free(int node) {
        finals.set(node, false);
        labels.get(node).clear();
        targets.get(node).clear();
        freeList.push(node);
        liveCount--;
    }

    boolean isFinal(int node) {
        return finals.getBoolean(node);
    }

    void setFinal(int node, boolean isFinal) {
        finals.set(node, isFinal);
    }

    int outDegree(int node) {
        return targets.get(node).size();
    }

    String label(int node, int edge) {
        return labels.get(node).get(edge);
    }

    int target(int node, int edge) {
        return targets.get(node).getInt(edge);
    }

    void addEdge(int node, String label, int target) {
        labels.get(node).add(label);
        targets.get(node).add(target);
    }

    void setEdge(int node, int edge, String label, int target) {
        labels.get(node).set(edge, label);
        targets.get(node).set(edge, target);
    }

    void setTarget(int node, int edge, int target) {
        targets.get(node).set(edge, target);
    }

    /**
     * @return number of slots ever created; valid node ids are below this
     */
    int capacity() {
        return finals.size();
    }

    int liveCount() {
        return liveCount;
    }

    long allocations() {
        return allocations;
    }
}
