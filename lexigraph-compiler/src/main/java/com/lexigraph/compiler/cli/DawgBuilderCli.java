package com.lexigraph.compiler.cli;

import com.lexigraph.api.exceptions.InvalidInputException;
import com.lexigraph.compiler.BuildOptions;
import com.lexigraph.compiler.BuildReport;
import com.lexigraph.compiler.DawgBuilder;
import com.lexigraph.compiler.WordListReader;
import com.lexigraph.infra.config.AlphabetRegistry;
import com.lexigraph.infra.config.LexiconConfig;
import com.lexigraph.infra.serialization.AutomatonCodec;
import com.lexigraph.infra.telemetry.TracingService;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command line entry point: compiles word lists into a serialized automaton.
 *
 * <pre>
 * dawg-builder [options] &lt;word-list&gt;... &lt;output&gt;
 *
 *   --alphabet=NAME        alphabet to validate against (default: LEXICON_ALPHABET or english)
 *   --alphabets=FILE       JSON alphabet declarations replacing the built-in ones
 *   --add=FILE             additional word list; may be repeated
 *   --remove=FILE          words to leave out; may be repeated
 *   --max-length=N         skip words longer than N letters
 *   --report=FILE          write build statistics as JSON
 *   --verbose              log every stage
 * </pre>
 *
 * Exit codes: 0 success, 1 invalid word list, 2 usage error, 3 I/O error.
 */
public class DawgBuilderCli {
    private static final Logger logger = Logger.getLogger(DawgBuilderCli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: dawg-builder [options] <word-list>... <output>",
            "  --alphabet=NAME     alphabet to validate against",
            "  --alphabets=FILE    JSON alphabet declarations",
            "  --add=FILE          additional word list (repeatable)",
            "  --remove=FILE       words to leave out (repeatable)",
            "  --max-length=N      skip words longer than N letters",
            "  --report=FILE       write build statistics as JSON",
            "  --verbose           log every stage");

    private final PrintStream out;
    private final PrintStream err;
    private final Tracer tracer;

    public DawgBuilderCli(PrintStream out, PrintStream err, Tracer tracer) {
        this.out = out;
        this.err = err;
        this.tracer = tracer;
    }

    public static void main(String[] args) {
        boolean verbose = List.of(args).contains("--verbose");
        configureLogging(verbose ? Level.FINE : Level.WARNING);
        int exitCode;
        try (TracingService tracing = TracingService.start("dawg-builder")) {
            exitCode = new DawgBuilderCli(System.out, System.err, tracing.getTracer()).run(args);
        }
        System.exit(exitCode);
    }

    public int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (arguments.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        try {
            LexiconConfig config = arguments.applyTo(LexiconConfig.fromEnvironment().toBuilder()).build();
            AlphabetRegistry registry = arguments.alphabets != null
                    ? AlphabetRegistry.load(arguments.alphabets)
                    : AlphabetRegistry.builtIn();
            BuildOptions.Builder optionsBuilder = BuildOptions.from(config, registry);

            WordListReader reader = new WordListReader(registry.get(config.getAlphabetName()));
            List<String> removals = new ArrayList<>();
            for (Path path : arguments.removals) {
                removals.addAll(reader.read(path));
            }
            BuildOptions options = optionsBuilder.removals(removals).build();

            DawgBuilder builder = new DawgBuilder(options, tracer);
            Automaton automaton = builder.build(arguments.inputs);
            new AutomatonCodec().write(automaton, arguments.output);

            BuildReport report = builder.getLastReport();
            if (arguments.report != null) {
                report.write(arguments.report);
            }
            out.printf("%s: %,d words (%,d read, %,d duplicates, %,d removed, %,d too long), %,d nodes, %,d edges in %d ms%n",
                    arguments.output, report.wordsAccepted(), report.wordsRead(), report.duplicates(),
                    report.removed(), report.tooLong(), report.nodeCount(), report.edgeCount(),
                    report.durationMillis());
            return EXIT_OK;
        } catch (InvalidInputException e) {
            err.println("error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            logger.log(Level.FINE, "Build failed", e);
            err.println("error: " + e);
            return EXIT_IO;
        }
    }

    private static void configureLogging(Level level) {
        LogManager.getLogManager().reset();
        Logger rootLogger = Logger.getLogger("");
        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(level);
        consoleHandler.setFormatter(new SimpleFormatter() {
            @Override
            public String format(LogRecord record) {
                return String.format("[%1$tT.%1$tL] [%2$-7s] %3$s%n",
                        new java.util.Date(record.getMillis()), record.getLevel(), formatMessage(record));
            }
        });
        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(level);
    }

    /**
     * Parsed command line.
     */
    static final class Arguments {
        String alphabet;
        Path alphabets;
        final List<Path> inputs = new ArrayList<>();
        final List<Path> removals = new ArrayList<>();
        int maxLength;
        Path report;
        Path output;
        boolean help;

        static Arguments parse(String[] args) {
            Arguments parsed = new Arguments();
            List<Path> positional = new ArrayList<>();
            List<Path> added = new ArrayList<>();
            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    parsed.help = true;
                    return parsed;
                } else if (arg.equals("--verbose")) {
                    continue;
                } else if (arg.startsWith("--alphabet=")) {
                    parsed.alphabet = value(arg);
                } else if (arg.startsWith("--alphabets=")) {
                    parsed.alphabets = Paths.get(value(arg));
                } else if (arg.startsWith("--add=")) {
                    added.add(Paths.get(value(arg)));
                } else if (arg.startsWith("--remove=")) {
                    parsed.removals.add(Paths.get(value(arg)));
                } else if (arg.startsWith("--max-length=")) {
                    try {
                        parsed.maxLength = Integer.parseInt(value(arg));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--max-length expects a number: " + value(arg));
                    }
                    if (parsed.maxLength <= 0) {
                        throw new IllegalArgumentException("--max-length must be positive");
                    }
                } else if (arg.startsWith("--report=")) {
                    parsed.report = Paths.get(value(arg));
                } else if (arg.startsWith("-")) {
                    throw new IllegalArgumentException("unknown option " + arg);
                } else {
                    positional.add(Paths.get(arg));
                }
            }
            if (positional.size() < 2) {
                throw new IllegalArgumentException("expected at least one word list and an output file");
            }
            parsed.output = positional.remove(positional.size() - 1);
            parsed.inputs.addAll(positional);
            parsed.inputs.addAll(added);
            return parsed;
        }

        /**
         * Overrides the configured alphabet and word length with the options given.
         */
        LexiconConfig.Builder applyTo(LexiconConfig.Builder config) {
            if (alphabet != null) {
                config.alphabet(alphabet);
            }
            if (maxLength > 0) {
                config.maxWordLength(maxLength);
            }
            return config;
        }

        private static String value(String arg) {
            String value = arg.substring(arg.indexOf('=') + 1);
            if (value.isEmpty()) {
                throw new IllegalArgumentException("missing value for " + arg);
            }
            return value;
        }
    }
}
