package com.lexigraph.compiler;

import com.lexigraph.api.BuildListener;
import com.lexigraph.api.IDawgBuilder;
import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.AutomatonStats;
import com.lexigraph.infra.telemetry.TracingService;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.logging.Logger;

/**
 * Compiles word lists into a minimal, edge-compacted automaton.
 *
 * The build runs in six stages:
 * 1. READING - read and validate the words against the alphabet.
 * 2. FILTERING - drop over-long words, words rejected by the filter and removed words.
 * 3. SORTING - sort by alphabet collation; caller order is never trusted. Duplicates are dropped.
 * 4. MINIMIZING - sorted incremental insertion with a build-scoped register.
 * 5. COLLAPSING - fold pass-through chains into multi-letter edges.
 * 6. CANONICALIZING - merge any remaining duplicate states, renumber in preorder and freeze.
 *
 * Every stage runs in its own span and is reported to the {@link BuildListener}, if any.
 * A builder instance can run many builds, one at a time.
 */
public class DawgBuilder implements IDawgBuilder {
    private static final Logger logger = Logger.getLogger(DawgBuilder.class.getName());

    enum Stage { READING, FILTERING, SORTING, MINIMIZING, COLLAPSING, CANONICALIZING }

    private static final String IN_MEMORY_SOURCE = "<input>";

    private final BuildOptions options;
    private Tracer tracer;
    private BuildListener listener;
    private BuildReport lastReport;

    public DawgBuilder(BuildOptions options, Tracer tracer) {
        this.options = options;
        this.tracer = tracer;
    }

    public DawgBuilder(Alphabet alphabet, Tracer tracer) {
        this(BuildOptions.builder(alphabet).build(), tracer);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setBuildListener(BuildListener listener) {
        this.listener = listener;
    }

    /**
     * @return statistics of the most recent successful build, or null before the first
     */
    public BuildReport getLastReport() {
        return lastReport;
    }

    @Override
    public Automaton build(Collection<String> words) {
        Span span = tracer.spanBuilder(TracingService.BUILD_SPAN).startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("source", IN_MEMORY_SOURCE);
            BuildRun run = new BuildRun(List.of(IN_MEMORY_SOURCE));
            List<String> read = runStage(run, Stage.READING, metrics -> {
                List<String> normalized = new WordListReader(options.alphabet()).read(words);
                metrics.put("wordsRead", (long) normalized.size());
                return normalized;
            });
            return compile(run, read, span);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Automaton build(List<Path> wordLists) throws IOException {
        if (wordLists.isEmpty()) {
            throw new IllegalArgumentException("At least one word list is required");
        }
        Span span = tracer.spanBuilder(TracingService.BUILD_SPAN).startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<String> sources = wordLists.stream().map(Path::toString).toList();
            span.setAttribute("source", String.join(",", sources));
            BuildRun run = new BuildRun(sources);
            List<String> read = runStage(run, Stage.READING, metrics -> {
                WordListReader reader = new WordListReader(options.alphabet());
                List<String> words = new ArrayList<>();
                for (Path path : wordLists) {
                    words.addAll(reader.read(path));
                }
                metrics.put("files", (long) wordLists.size());
                metrics.put("wordsRead", (long) words.size());
                return words;
            });
            return compile(run, read, span);
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Automaton compile(BuildRun run, List<String> read, Span span) {
        run.wordsRead = read.size();
        span.setAttribute("wordsRead", run.wordsRead);

        List<String> kept = runStage(run, Stage.FILTERING, metrics -> filter(read, run, metrics));

        String[] sorted = runStage(run, Stage.SORTING, metrics -> {
            String[] words = kept.toArray(new String[0]);
            Arrays.parallelSort(words, options.alphabet().collator());
            int unique = dropAdjacentDuplicates(words);
            run.duplicates = words.length - unique;
            metrics.put("duplicates", run.duplicates);
            metrics.put("uniqueWords", (long) unique);
            return Arrays.copyOf(words, unique);
        });

        IncrementalMinimizer minimizer = runStage(run, Stage.MINIMIZING, metrics -> {
            IncrementalMinimizer m = new IncrementalMinimizer(options.alphabet().collator());
            for (String word : sorted) {
                m.add(word);
            }
            NodeArena arena = m.finish();
            metrics.put("nodesCreated", arena.allocations());
            metrics.put("nodesMerged", (long) m.mergedNodes());
            metrics.put("liveNodes", (long) arena.liveCount());
            return m;
        });
        NodeArena arena = minimizer.finish();

        runStage(run, Stage.COLLAPSING, metrics -> {
            ChainCollapser collapser = new ChainCollapser();
            collapser.collapse(arena, minimizer.root());
            metrics.put("nodesFolded", (long) collapser.foldedNodes());
            metrics.put("multiLetterEdges", (long) collapser.multiLetterEdges());
            metrics.put("liveNodes", (long) arena.liveCount());
            return null;
        });

        Automaton automaton = runStage(run, Stage.CANONICALIZING, metrics -> {
            StateCanonicalizer canonicalizer = new StateCanonicalizer();
            Automaton result = canonicalizer.canonicalize(arena, minimizer.root(), options.alphabet());
            AutomatonStats stats = result.getStats();
            if (stats.wordCount() != sorted.length) {
                throw new IllegalStateException("Automaton accepts " + stats.wordCount()
                        + " words but " + sorted.length + " were inserted");
            }
            metrics.put("statesMerged", (long) canonicalizer.mergedStates());
            metrics.put("nodeCount", (long) stats.nodeCount());
            metrics.put("edgeCount", (long) stats.edgeCount());
            return result;
        });

        AutomatonStats stats = automaton.getStats();
        long durationNanos = System.nanoTime() - run.startNanos;
        span.setAttribute("wordCount", stats.wordCount());
        span.setAttribute("nodeCount", stats.nodeCount());
        span.setAttribute("edgeCount", stats.edgeCount());
        span.setAttribute("buildTimeMs", TimeUnit.NANOSECONDS.toMillis(durationNanos));

        lastReport = new BuildReport(
                options.alphabet().name(),
                run.sources,
                run.wordsRead,
                stats.wordCount(),
                run.duplicates,
                run.removed,
                run.tooLong,
                run.filtered,
                stats.nodeCount(),
                stats.edgeCount(),
                stats.labelChars(),
                stats.maxWordLength(),
                TimeUnit.NANOSECONDS.toMillis(durationNanos),
                run.stageMillis);

        logger.info(String.format("Built automaton: %,d words, %,d nodes, %,d edges in %d ms",
                stats.wordCount(), stats.nodeCount(), stats.edgeCount(),
                TimeUnit.NANOSECONDS.toMillis(durationNanos)));
        return automaton;
    }

    private List<String> filter(List<String> words, BuildRun run, Map<String, Object> metrics) {
        int maxLength = options.maxWordLength();
        Predicate<String> wordFilter = options.wordFilter();
        List<String> kept = new ArrayList<>(words.size());
        for (String word : words) {
            if (word.length() > maxLength) {
                run.tooLong++;
            } else if (options.removals().contains(word)) {
                run.removed++;
            } else if (!wordFilter.test(word)) {
                run.filtered++;
            } else {
                kept.add(word);
            }
        }
        metrics.put("tooLong", run.tooLong);
        metrics.put("removed", run.removed);
        metrics.put("filtered", run.filtered);
        metrics.put("kept", (long) kept.size());
        if (run.tooLong > 0) {
            logger.fine("Skipped " + run.tooLong + " words longer than " + maxLength + " letters");
        }
        return kept;
    }

    /**
     * Compacts a sorted array in place.
     *
     * @return number of distinct words now at the front of the array
     */
    private static int dropAdjacentDuplicates(String[] sorted) {
        if (sorted.length == 0) {
            return 0;
        }
        int unique = 1;
        for (int i = 1; i < sorted.length; i++) {
            if (!sorted[i].equals(sorted[unique - 1])) {
                sorted[unique++] = sorted[i];
            }
        }
        return unique;
    }

    @FunctionalInterface
    private interface StageWork<T, E extends Exception> {
        T run(Map<String, Object> metrics) throws E;
    }

    private <T, E extends Exception> T runStage(BuildRun run, Stage stage, StageWork<T, E> work) throws E {
        String stageName = stage.name();
        Span span = tracer.spanBuilder(TracingService.stageSpan(stageName)).startSpan();
        if (listener != null) {
            listener.onStageStart(stageName, stage.ordinal() + 1, Stage.values().length);
        }
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            Map<String, Object> metrics = new LinkedHashMap<>();
            T result = work.run(metrics);
            long duration = System.nanoTime() - start;
            run.stageMillis.put(stageName, TimeUnit.NANOSECONDS.toMillis(duration));
            metrics.forEach((key, value) -> {
                if (value instanceof Number number) {
                    span.setAttribute(key, number.longValue());
                } else {
                    span.setAttribute(key, String.valueOf(value));
                }
            });
            if (listener != null) {
                listener.onStageComplete(stageName, new BuildListener.StageResult(stageName, duration, Map.copyOf(metrics)));
            }
            logger.fine(() -> String.format("%s completed in %.2f ms: %s", stageName, duration / 1_000_000.0, metrics));
            return result;
        } catch (Exception e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Counters of a single build.
     */
    private static final class BuildRun {
        final List<String> sources;
        final long startNanos = System.nanoTime();
        final Map<String, Long> stageMillis = new LinkedHashMap<>();
        long wordsRead;
        long duplicates;
        long removed;
        long tooLong;
        long filtered;

        BuildRun(List<String> sources) {
            this.sources = sources;
        }
    }
}
