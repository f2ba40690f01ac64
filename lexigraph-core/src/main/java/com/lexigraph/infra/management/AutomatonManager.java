package com.lexigraph.infra.management;

import com.lexigraph.api.IAutomatonLoader;
import com.lexigraph.api.model.AutomatonStats;
import com.lexigraph.infra.config.LexiconConfig;
import com.lexigraph.infra.telemetry.TracingService;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the active automaton of a long-running process and swaps in a new one
 * when the serialized file changes.
 *
 * <p>The initial load fails fast. Later reloads that fail are logged and the
 * previous automaton stays active.
 */
public class AutomatonManager implements Supplier<Automaton> {
    private static final Logger logger = Logger.getLogger(AutomatonManager.class.getName());

    private final Path dawgPath;
    private final IAutomatonLoader loader;
    private final long checkIntervalSeconds;

    /**
     * Holds the currently active automaton.
     * <p>
     * Readers always see a complete, immutable automaton without locking, even
     * while a reload is in progress.
     */
    private final AtomicReference<Automaton> activeAutomaton = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;
    private final Tracer tracer;

    private volatile long lastModifiedTime = -1;

    public AutomatonManager(Path dawgPath, Tracer tracer, IAutomatonLoader loader) throws IOException {
        this(dawgPath, tracer, loader, 10);
    }

    public AutomatonManager(LexiconConfig config, Tracer tracer, IAutomatonLoader loader) throws IOException {
        this(config.getDawgPath(), tracer, loader, config.getReloadIntervalSeconds());
    }

    private AutomatonManager(Path dawgPath, Tracer tracer, IAutomatonLoader loader, long checkIntervalSeconds)
            throws IOException {
        this.dawgPath = dawgPath;
        this.tracer = tracer;
        this.loader = loader;
        this.checkIntervalSeconds = checkIntervalSeconds;
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Lexicon-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadInternal(); // Initial load, fail fast
    }

    public Automaton getAutomaton() {
        return activeAutomaton.get();
    }

    @Override
    public Automaton get() {
        return activeAutomaton.get();
    }

    public void start() {
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates,
                checkIntervalSeconds, checkIntervalSeconds, TimeUnit.SECONDS);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Reloads the file now, whether or not it changed.
     *
     * @throws IOException if the file cannot be read
     * @throws com.lexigraph.api.exceptions.FormatException if the file is malformed;
     *         the previous automaton stays active
     */
    public void reload() throws IOException {
        Span span = tracer.spanBuilder(TracingService.MANUAL_RELOAD_SPAN).startSpan();
        try (Scope scope = span.makeCurrent()) {
            reloadInternal();
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void checkForUpdates() {
        Span span = tracer.spanBuilder(TracingService.UPDATE_CHECK_SPAN).startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("dawgFile", dawgPath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(dawgPath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in lexicon file. Attempting to reload...");
                loadAutomaton();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check lexicon file for modifications.", e);
        } catch (Exception e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "An unexpected error occurred during lexicon reload check.", e);
        } finally {
            span.end();
        }
    }

    private void loadAutomaton() {
        try {
            reloadInternal();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to load new lexicon. Old automaton remains active.", e);
        }
    }

    private void reloadInternal() throws IOException {
        Span span = tracer.spanBuilder(TracingService.LOAD_SPAN).startSpan();
        try (Scope scope = span.makeCurrent()) {
            long modifiedTime = Files.getLastModifiedTime(dawgPath).toMillis();
            long start = System.nanoTime();
            Automaton automaton = loader.load(dawgPath);
            activeAutomaton.set(automaton);
            this.lastModifiedTime = modifiedTime;

            AutomatonStats stats = automaton.getStats();
            span.setAttribute("newAutomaton.nodeCount", stats.nodeCount());
            span.setAttribute("newAutomaton.wordCount", stats.wordCount());
            logger.info(String.format("Loaded lexicon %s: %,d words, %,d nodes in %.2f ms",
                    dawgPath, stats.wordCount(), stats.nodeCount(), (System.nanoTime() - start) / 1_000_000.0));
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
