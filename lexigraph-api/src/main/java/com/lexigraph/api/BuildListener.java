/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.api;

import java.util.Map;

/**
 * Callback interface for build stage events.
 * Lets CLIs and monitoring code follow a dictionary build as it runs.
 *
 * <p>The build pipeline consists of 6 stages:
 * <ol>
 *   <li>READING - Read and validate the word lists</li>
 *   <li>FILTERING - Drop over-long, filtered and removed words</li>
 *   <li>SORTING - Sort by alphabet collation and drop duplicates</li>
 *   <li>MINIMIZING - Insert words into the minimal automaton</li>
 *   <li>COLLAPSING - Fold single-letter chains into multi-letter edges</li>
 *   <li>CANONICALIZING - Verify, renumber and freeze the automaton</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * BuildListener listener = new BuildListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d ms%n", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * IDawgBuilder builder = new DawgBuilder(options, tracer);
 * builder.setBuildListener(listener);
 * Automaton automaton = builder.build(wordListPath);
 * </pre>
 */
public interface BuildListener {

    /**
     * Called when a build stage starts.
     *
     * @param stageName Name of the stage (e.g., "READING", "MINIMIZING")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a build stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a build stage fails.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single build stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "wordsRead", "nodeCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
