/*
 * Copyright (c) 2025 Lexigraph
 * Licensed under the Apache License, Version 2.0
 */
package com.lexigraph.cache;

import com.lexigraph.api.IWordFinder;
import com.lexigraph.api.exceptions.InvalidRackException;
import com.lexigraph.api.model.Alphabet;
import com.lexigraph.api.model.Pattern;
import com.lexigraph.api.model.Rack;
import com.lexigraph.api.model.WordMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingWordFinderTest {

    private static final Alphabet ENGLISH = Alphabet.of("english", "abcdefghijklmnopqrstuvwxyz");

    @Mock
    private IWordFinder delegate;

    private CachingWordFinder finder;

    @BeforeEach
    void setUp() {
        finder = new CachingWordFinder(delegate, 100);
    }

    @Test
    void sameTilesInAnyOrderHitTheCache() {
        List<WordMatch> result = List.of(new WordMatch("tab", "tab"));
        when(delegate.expand(any(Rack.class), isNull(), eq(1))).thenReturn(result);

        assertThat(finder.expand(Rack.parse("bat", ENGLISH))).isEqualTo(result);
        assertThat(finder.expand(Rack.parse("TAB", ENGLISH))).isEqualTo(result);

        verify(delegate, times(1)).expand(any(Rack.class), isNull(), eq(1));
        assertThat(finder.getStats()).containsEntry("expansionHits", 1L).containsEntry("expansionMisses", 1L);
    }

    @Test
    void patternAndMinLengthArePartOfTheKey() {
        Rack rack = Rack.parse("bat", ENGLISH);
        Pattern pattern = Pattern.parse("?a?", ENGLISH);
        when(delegate.expand(eq(rack), any(), anyInt())).thenReturn(List.of());

        finder.expand(rack, null, 1);
        finder.expand(rack, pattern, 1);
        finder.expand(rack, null, 3);
        finder.expand(rack, Pattern.parse("?A?", ENGLISH), 1);

        verify(delegate, times(3)).expand(eq(rack), any(), anyInt());
    }

    @Test
    void cachesPatternMatches() {
        Pattern pattern = Pattern.parse("c?t", ENGLISH);
        when(delegate.match(pattern)).thenReturn(List.of("cat", "cot"));

        finder.match(pattern);
        List<String> second = finder.match(Pattern.parse("c?t", ENGLISH));

        assertThat(second).containsExactly("cat", "cot");
        verify(delegate, times(1)).match(any());
    }

    @Test
    void lookupsAndAnalysesPassThrough() {
        when(delegate.lookup("cat")).thenReturn(true);

        assertThat(finder.lookup("cat")).isTrue();
        assertThat(finder.lookup("cat")).isTrue();
        finder.analyze(Rack.parse("cat", ENGLISH));

        verify(delegate, times(2)).lookup("cat");
        verify(delegate).analyze(any());
    }

    @Test
    void failuresAreNotCached() {
        Rack rack = Rack.parse("??", ENGLISH);
        when(delegate.expand(eq(rack), isNull(), eq(1))).thenThrow(new InvalidRackException("too many wildcards"));

        assertThatThrownBy(() -> finder.expand(rack)).isInstanceOf(InvalidRackException.class);
        assertThatThrownBy(() -> finder.expand(rack)).isInstanceOf(InvalidRackException.class);

        verify(delegate, times(2)).expand(eq(rack), isNull(), eq(1));
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> new CachingWordFinder(delegate, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
