package com.lexigraph.benchmark;

import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.Pattern;
import com.lexigraph.api.model.Rack;
import com.lexigraph.api.model.WordMatch;
import com.lexigraph.compiler.DawgBuilder;
import com.lexigraph.runtime.evaluation.QueryEngine;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Dictionary build and query throughput on a synthetic word list.
 * <p>
 * Words are generated from a fixed seed with English-like letter frequencies,
 * so runs are comparable across machines and commits.
 * <p>
 * USAGE:
 * mvn clean package -pl lexigraph-benchmarks -am -DskipTests
 * java -jar lexigraph-benchmarks/target/benchmarks.jar QueryBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : fewer, shorter iterations
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class QueryBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    private static final Alphabet ENGLISH = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");
    private static final String WEIGHTED_LETTERS =
            "eeeeeeeeeeeeaaaaaaaaaiiiiiiiiioooooooonnnnnnrrrrrrttttttllllssssuuuuddddgggbbccmmppffhhvvwwyykjxqz";
    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");

    @Param({"50000", "200000"})
    private int wordCount;

    private List<String> words;
    private QueryEngine engine;
    private Rack[] racks;
    private Rack[] wildcardRacks;
    private Pattern[] patterns;
    private int next;

    @Setup(Level.Trial)
    public void setupTrial() {
        Logger.getLogger("com.lexigraph").setLevel(java.util.logging.Level.WARNING);
        Random random = new Random(2025);
        words = new ArrayList<>(wordCount);
        for (int i = 0; i < wordCount; i++) {
            words.add(randomWord(random, 2 + random.nextInt(9)));
        }
        Automaton automaton = new DawgBuilder(ENGLISH, NOOP_TRACER).build(words);
        engine = new QueryEngine(automaton, NOOP_TRACER, 16, 2);

        racks = new Rack[256];
        wildcardRacks = new Rack[256];
        patterns = new Pattern[256];
        for (int i = 0; i < racks.length; i++) {
            String tiles = randomWord(random, 7);
            racks[i] = engine.parseRack(tiles);
            wildcardRacks[i] = engine.parseRack(tiles.substring(0, 5) + "??");
            patterns[i] = Pattern.parse("?" + tiles.charAt(0) + "??" + tiles.charAt(1), ENGLISH);
        }
        System.out.printf("Built %,d words into %,d nodes%n",
                automaton.getStats().wordCount(), automaton.nodeCount());
    }

    @Benchmark
    public void lookup(Blackhole bh) {
        bh.consume(engine.lookup(words.get(Math.floorMod(next++, wordCount))));
    }

    @Benchmark
    public void expandRack(Blackhole bh) {
        List<WordMatch> result = engine.expand(racks[next++ & 0xFF]);
        bh.consume(result);
    }

    @Benchmark
    public void expandRackWithWildcards(Blackhole bh) {
        bh.consume(engine.expand(wildcardRacks[next++ & 0xFF]));
    }

    @Benchmark
    public void expandPattern(Blackhole bh) {
        int i = next++ & 0xFF;
        bh.consume(engine.expand(wildcardRacks[i], patterns[i]));
    }

    @Benchmark
    public void analyzeRack(Blackhole bh) {
        bh.consume(engine.analyze(racks[next++ & 0xFF]));
    }

    @Benchmark
    @BenchmarkMode(Mode.SingleShotTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    @Warmup(iterations = 2)
    @Measurement(iterations = 5)
    public Automaton build() {
        return new DawgBuilder(ENGLISH, NOOP_TRACER).build(words);
    }

    private static String randomWord(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(WEIGHTED_LETTERS.charAt(random.nextInt(WEIGHTED_LETTERS.length())));
        }
        return sb.toString();
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(QueryBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .build();
        new Runner(options).run();
    }
}
