package com.lexigraph.infra.management;

import com.lexigraph.api.IAutomatonLoader;
import com.lexigraph.api.exceptions.FormatException;
import com.lexigraph.api.model.Alphabet;
import com.lexigraph.infra.config.LexiconConfig;
import com.lexigraph.runtime.model.Automaton;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutomatonManagerTest {

    private static final Alphabet ENGLISH = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");

    @Mock
    private IAutomatonLoader loader;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @TempDir
    Path tempDir;

    private Path dawgPath;

    @BeforeEach
    void setUp() throws IOException {
        dawgPath = tempDir.resolve("lexicon.dawg");
        Files.writeString(dawgPath, "placeholder");

        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
    }

    private static Automaton singleWord(String word) {
        Automaton.Builder builder = new Automaton.Builder(ENGLISH);
        builder.addNode(false);
        builder.addEdge(word, 1);
        builder.addNode(true);
        return builder.build();
    }

    private void touchLater() throws IOException {
        FileTime later = FileTime.fromMillis(Files.getLastModifiedTime(dawgPath).toMillis() + 5_000);
        Files.setLastModifiedTime(dawgPath, later);
    }

    private static void invokeCheckForUpdates(AutomatonManager manager) throws Exception {
        Method checkMethod = AutomatonManager.class.getDeclaredMethod("checkForUpdates");
        checkMethod.setAccessible(true);
        checkMethod.invoke(manager);
    }

    @Test
    void shouldLoadAutomatonOnInitialization() throws Exception {
        Automaton automaton = singleWord("cat");
        when(loader.load(any(Path.class))).thenReturn(automaton);

        AutomatonManager manager = new AutomatonManager(dawgPath, tracer, loader);

        assertThat(manager.getAutomaton()).isSameAs(automaton);
        assertThat(manager.get()).isSameAs(automaton);
        verify(loader).load(dawgPath);
    }

    @Test
    void shouldThrowExceptionIfInitialLoadFails() throws Exception {
        when(loader.load(any(Path.class))).thenThrow(new FormatException("missing header", 1));

        assertThatThrownBy(() -> new AutomatonManager(dawgPath, tracer, loader))
                .isInstanceOf(FormatException.class);
        verify(span).recordException(any(FormatException.class));
    }

    @Test
    void shouldReloadWhenFileChanges() throws Exception {
        Automaton first = singleWord("cat");
        Automaton second = singleWord("dog");
        when(loader.load(any(Path.class))).thenReturn(first);

        AutomatonManager manager = new AutomatonManager(dawgPath, tracer, loader);
        when(loader.load(any(Path.class))).thenReturn(second);
        touchLater();

        invokeCheckForUpdates(manager);

        assertThat(manager.getAutomaton()).isSameAs(second);
        verify(loader, times(2)).load(dawgPath);
        manager.shutdown();
    }

    @Test
    void shouldNotReloadUnchangedFile() throws Exception {
        when(loader.load(any(Path.class))).thenReturn(singleWord("cat"));

        AutomatonManager manager = new AutomatonManager(dawgPath, tracer, loader);
        invokeCheckForUpdates(manager);

        verify(loader, times(1)).load(dawgPath);
    }

    @Test
    void shouldKeepOldAutomatonIfReloadFails() throws Exception {
        Automaton automaton = singleWord("cat");
        when(loader.load(any(Path.class))).thenReturn(automaton);

        AutomatonManager manager = new AutomatonManager(dawgPath, tracer, loader);
        when(loader.load(any(Path.class))).thenThrow(new FormatException("line 3: edge 'b' points to unknown node 7"));
        touchLater();

        invokeCheckForUpdates(manager);

        assertThat(manager.getAutomaton()).isSameAs(automaton);
        verify(loader, times(2)).load(dawgPath);
    }

    @Test
    void manualReloadPropagatesFailureAndKeepsOldAutomaton() throws Exception {
        Automaton automaton = singleWord("cat");
        when(loader.load(any(Path.class))).thenReturn(automaton);
        AutomatonManager manager = new AutomatonManager(dawgPath, tracer, loader);

        when(loader.load(any(Path.class))).thenThrow(new IOException("disk gone"));

        assertThatThrownBy(manager::reload).isInstanceOf(IOException.class);
        assertThat(manager.getAutomaton()).isSameAs(automaton);
    }

    @Test
    void usesPathFromConfiguration() throws Exception {
        Automaton automaton = singleWord("cat");
        when(loader.load(any(Path.class))).thenReturn(automaton);
        LexiconConfig config = LexiconConfig.defaults().dawgPath(dawgPath).reloadIntervalSeconds(1).build();

        AutomatonManager manager = new AutomatonManager(config, tracer, loader);

        assertThat(manager.getAutomaton()).isSameAs(automaton);
        verify(loader).load(dawgPath);
    }
}
