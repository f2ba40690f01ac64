package com.lexigraph.compiler.cli;

import com.lexigraph.compiler.BuildReport;
import com.lexigraph.infra.serialization.AutomatonCodec;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DawgBuilderCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private DawgBuilderCli cli;

    @BeforeEach
    void setUp() {
        cli = new DawgBuilderCli(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                OpenTelemetry.noop().getTracer("test"));
    }

    private Path file(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    private static List<String> words(Automaton automaton) {
        List<String> words = new ArrayList<>();
        automaton.forEachWord(words::add);
        return words;
    }

    @Test
    @DisplayName("Should compile word lists, apply removals and write a report")
    void buildsDictionaryWithReport() throws IOException {
        Path main = file("main.txt", "apple\nbanana\ncherry\n");
        Path extra = file("extra.txt", "date\napple\n");
        Path removals = file("remove.txt", "banana\n");
        Path output = tempDir.resolve("out/fruit.dawg");
        Path report = tempDir.resolve("out/report.json");

        int exit = cli.run(new String[]{
                "--add=" + extra, "--remove=" + removals, "--report=" + report, main.toString(), output.toString()});

        assertThat(exit).isEqualTo(DawgBuilderCli.EXIT_OK);
        assertThat(words(new AutomatonCodec().load(output))).containsExactly("apple", "cherry", "date");
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("3 words");

        BuildReport written = BuildReport.read(report);
        assertThat(written.wordsRead()).isEqualTo(5);
        assertThat(written.wordsAccepted()).isEqualTo(3);
        assertThat(written.duplicates()).isEqualTo(1);
        assertThat(written.removed()).isEqualTo(1);
        assertThat(written.sources()).containsExactly(main.toString(), extra.toString());
        assertThat(Files.readString(report)).contains("\"words_accepted\" : 3");
    }

    @Test
    void honoursAlphabetAndMaxLength() throws IOException {
        Path input = file("is.txt", "ás\nþorp\nþorpari\n");
        Path output = tempDir.resolve("is.dawg");

        int exit = cli.run(new String[]{"--alphabet=icelandic", "--max-length=4", input.toString(), output.toString()});

        assertThat(exit).isEqualTo(DawgBuilderCli.EXIT_OK);
        Automaton automaton = new AutomatonCodec().load(output);
        assertThat(automaton.getAlphabet().name()).isEqualTo("icelandic");
        assertThat(words(automaton)).containsExactly("ás", "þorp");
    }

    @Test
    void maxLengthAboveCeilingIsUsageError() throws IOException {
        Path input = file("words.txt", "word\n");

        int exit = cli.run(new String[]{"--max-length=49", input.toString(), tempDir.resolve("x.dawg").toString()});

        assertThat(exit).isEqualTo(DawgBuilderCli.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("maxWordLength");
    }

    @Test
    void invalidWordExitsWithOne() throws IOException {
        Path input = file("bad.txt", "good\nb@d\n");
        Path output = tempDir.resolve("bad.dawg");

        int exit = cli.run(new String[]{input.toString(), output.toString()});

        assertThat(exit).isEqualTo(DawgBuilderCli.EXIT_INVALID_INPUT);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains(input + ":2:");
        assertThat(output).doesNotExist();
    }

    @Test
    void missingArgumentsExitWithUsage() {
        int exit = cli.run(new String[]{"only-one.txt"});

        assertThat(exit).isEqualTo(DawgBuilderCli.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Usage:");
    }

    @Test
    void unknownOptionExitsWithUsage() {
        assertThat(cli.run(new String[]{"--fast", "a.txt", "b.dawg"})).isEqualTo(DawgBuilderCli.EXIT_USAGE);
        assertThat(cli.run(new String[]{"--max-length=many", "a.txt", "b.dawg"})).isEqualTo(DawgBuilderCli.EXIT_USAGE);
    }

    @Test
    void unknownAlphabetExitsWithUsage() throws IOException {
        Path input = file("words.txt", "word\n");

        int exit = cli.run(new String[]{"--alphabet=klingon", input.toString(), tempDir.resolve("x.dawg").toString()});

        assertThat(exit).isEqualTo(DawgBuilderCli.EXIT_USAGE);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("klingon");
    }

    @Test
    void missingInputFileExitsWithThree() {
        int exit = cli.run(new String[]{tempDir.resolve("absent.txt").toString(), tempDir.resolve("x.dawg").toString()});

        assertThat(exit).isEqualTo(DawgBuilderCli.EXIT_IO);
    }

    @Test
    void helpPrintsUsage() {
        assertThat(cli.run(new String[]{"--help"})).isEqualTo(DawgBuilderCli.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("--max-length=N");
    }
}
