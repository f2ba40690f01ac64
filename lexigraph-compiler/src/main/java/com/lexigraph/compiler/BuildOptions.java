package com.lexigraph.compiler;

import com.lexigraph.api.model.Alphabet;
import com.lexigraph.infra.config.AlphabetRegistry;
import com.lexigraph.infra.config.LexiconConfig;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Settings for one dictionary build.
 *
 * <pre>{@code
 * BuildOptions options = BuildOptions.builder(AlphabetRegistry.builtIn().get("icelandic"))
 *     .maxWordLength(15)
 *     .removals(Set.of("bölvaður"))
 *     .build();
 * }</pre>
 */
public final class BuildOptions {

    private final Alphabet alphabet;
    private final int maxWordLength;
    private final Predicate<String> wordFilter;
    private final Set<String> removals;

    private BuildOptions(Builder builder) {
        this.alphabet = builder.alphabet;
        this.maxWordLength = builder.maxWordLength;
        this.wordFilter = builder.wordFilter;
        this.removals = Set.copyOf(builder.removals);
    }

    public static Builder builder(Alphabet alphabet) {
        return new Builder(alphabet);
    }

    /**
     * Builder preset to the configured alphabet and word length.
     *
     * @throws IllegalArgumentException if the registry has no such alphabet
     */
    public static Builder from(LexiconConfig config, AlphabetRegistry registry) {
        return builder(registry.get(config.getAlphabetName()))
                .maxWordLength(config.getMaxWordLength());
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public int maxWordLength() {
        return maxWordLength;
    }

    /**
     * @return predicate a normalized word must pass to be included
     */
    public Predicate<String> wordFilter() {
        return wordFilter;
    }

    /**
     * @return normalized words excluded from the build
     */
    public Set<String> removals() {
        return removals;
    }

    public static class Builder {
        private final Alphabet alphabet;
        private int maxWordLength = LexiconConfig.MAX_WORD_LENGTH;
        private Predicate<String> wordFilter = word -> true;
        private final Set<String> removals = new HashSet<>();

        private Builder(Alphabet alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet must not be null");
        }

        public Builder maxWordLength(int maxWordLength) {
            this.maxWordLength = maxWordLength;
            return this;
        }

        public Builder wordFilter(Predicate<String> wordFilter) {
            this.wordFilter = Objects.requireNonNull(wordFilter, "wordFilter must not be null");
            return this;
        }

        /**
         * Adds words to exclude. They are normalized the same way as input words.
         */
        public Builder removals(Collection<String> words) {
            for (String word : words) {
                String normalized = alphabet.normalize(word.strip());
                if (!normalized.isEmpty()) {
                    removals.add(normalized);
                }
            }
            return this;
        }

        public BuildOptions build() {
            validate();
            return new BuildOptions(this);
        }

        private void validate() {
            if (maxWordLength <= 0 || maxWordLength > LexiconConfig.MAX_WORD_LENGTH) {
                throw new IllegalStateException("maxWordLength must be between 1 and "
                        + LexiconConfig.MAX_WORD_LENGTH + ": " + maxWordLength);
            }
        }
    }
}
