package com.lexigraph.compiler;

import com.lexigraph.api.exceptions.InvalidInputException;
import com.lexigraph.api.model.Alphabet;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DawgBuilderTracingTest {

    private static final Alphabet ENGLISH = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @BeforeEach
    void setUp() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);
    }

    @Test
    void opensOneSpanPerStageInsideBuildSpan() {
        new DawgBuilder(ENGLISH, tracer).build(List.of("word", "words"));

        InOrder inOrder = inOrder(tracer);
        inOrder.verify(tracer).spanBuilder("build-dawg");
        inOrder.verify(tracer).spanBuilder("build-reading");
        inOrder.verify(tracer).spanBuilder("build-filtering");
        inOrder.verify(tracer).spanBuilder("build-sorting");
        inOrder.verify(tracer).spanBuilder("build-minimizing");
        inOrder.verify(tracer).spanBuilder("build-collapsing");
        inOrder.verify(tracer).spanBuilder("build-canonicalizing");
        verify(span, times(7)).end();
        verify(scope, times(7)).close();
        verify(span).setAttribute("wordCount", 2L);
    }

    @Test
    void recordsFailureOnStageAndBuildSpans() {
        DawgBuilder builder = new DawgBuilder(ENGLISH, tracer);

        assertThatThrownBy(() -> builder.build(List.of("fine", "n0pe")))
                .isInstanceOf(InvalidInputException.class);

        verify(span, times(2)).recordException(any(InvalidInputException.class));
        verify(span, times(2)).end();
        verify(tracer, never()).spanBuilder("build-filtering");
    }
}
