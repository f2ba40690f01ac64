package com.lexigraph.infra.config;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runtime configuration for building and serving a dictionary.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden by an environment variable or, when the
 * variable is unset, by a system property of the same name:
 * <pre>
 * LEXICON_DAWG_PATH=/srv/lexicon/ordalisti.dawg
 * LEXICON_ALPHABET=icelandic
 * LEXICON_MAX_WORD_LENGTH=15
 * LEXICON_MAX_RACK_SIZE=7
 * LEXICON_MAX_WILDCARDS=2
 * LEXICON_RELOAD_INTERVAL_SECONDS=30
 * LEXICON_QUERY_CACHE_SIZE=0
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Defaults with env override
 * LexiconConfig config = LexiconConfig.fromEnvironment();
 *
 * // Board-game limits
 * LexiconConfig config = LexiconConfig.builder()
 *     .maxRackSize(7)
 *     .maxWildcards(2)
 *     .maxWordLength(15)
 *     .build();
 * }</pre>
 */
public final class LexiconConfig {

    private static final Logger logger = Logger.getLogger(LexiconConfig.class.getName());

    /** Longest word the builder will ever accept. */
    public static final int MAX_WORD_LENGTH = 48;

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_DAWG_PATH = "LEXICON_DAWG_PATH";
    static final String ENV_ALPHABET = "LEXICON_ALPHABET";
    static final String ENV_MAX_WORD_LENGTH = "LEXICON_MAX_WORD_LENGTH";
    static final String ENV_MAX_RACK_SIZE = "LEXICON_MAX_RACK_SIZE";
    static final String ENV_MAX_WILDCARDS = "LEXICON_MAX_WILDCARDS";
    static final String ENV_RELOAD_INTERVAL_SECONDS = "LEXICON_RELOAD_INTERVAL_SECONDS";
    static final String ENV_QUERY_CACHE_SIZE = "LEXICON_QUERY_CACHE_SIZE";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final Path dawgPath;
    private final String alphabetName;
    private final int maxWordLength;
    private final int maxRackSize;
    private final int maxWildcards;
    private final long reloadIntervalSeconds;
    private final long queryCacheSize;

    private LexiconConfig(Builder builder) {
        this.dawgPath = builder.dawgPath;
        this.alphabetName = builder.alphabetName;
        this.maxWordLength = builder.maxWordLength;
        this.maxRackSize = builder.maxRackSize;
        this.maxWildcards = builder.maxWildcards;
        this.reloadIntervalSeconds = builder.reloadIntervalSeconds;
        this.queryCacheSize = builder.queryCacheSize;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults overridden by whatever the environment sets.
     */
    public static LexiconConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Builder pre-loaded with defaults and environment overrides.
     */
    public static Builder builder() {
        Builder builder = new Builder();
        builder.applyEnvironmentVariables();
        return builder;
    }

    /**
     * Builder pre-loaded with defaults only; the environment is ignored.
     */
    public static Builder defaults() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.dawgPath = this.dawgPath;
        builder.alphabetName = this.alphabetName;
        builder.maxWordLength = this.maxWordLength;
        builder.maxRackSize = this.maxRackSize;
        builder.maxWildcards = this.maxWildcards;
        builder.reloadIntervalSeconds = this.reloadIntervalSeconds;
        builder.queryCacheSize = this.queryCacheSize;
        return builder;
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public Path getDawgPath() {
        return dawgPath;
    }

    public String getAlphabetName() {
        return alphabetName;
    }

    public int getMaxWordLength() {
        return maxWordLength;
    }

    public int getMaxRackSize() {
        return maxRackSize;
    }

    public int getMaxWildcards() {
        return maxWildcards;
    }

    public long getReloadIntervalSeconds() {
        return reloadIntervalSeconds;
    }

    /**
     * @return maximum cached query results; 0 disables the cache
     */
    public long getQueryCacheSize() {
        return queryCacheSize;
    }

    public boolean isQueryCacheEnabled() {
        return queryCacheSize > 0;
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (dawgPath == null) {
            throw new IllegalArgumentException("dawgPath must not be null");
        }
        if (alphabetName == null || alphabetName.isBlank()) {
            throw new IllegalArgumentException("alphabetName must not be empty");
        }
        if (maxWordLength <= 0 || maxWordLength > MAX_WORD_LENGTH) {
            throw new IllegalArgumentException(
                    "maxWordLength must be between 1 and " + MAX_WORD_LENGTH + ": " + maxWordLength);
        }
        if (maxRackSize <= 0) {
            throw new IllegalArgumentException("maxRackSize must be positive: " + maxRackSize);
        }
        if (maxWildcards < 0 || maxWildcards > maxRackSize) {
            throw new IllegalArgumentException(
                    "maxWildcards must be between 0 and maxRackSize (" + maxRackSize + "): " + maxWildcards);
        }
        if (reloadIntervalSeconds <= 0) {
            throw new IllegalArgumentException("reloadIntervalSeconds must be positive: " + reloadIntervalSeconds);
        }
        if (queryCacheSize < 0) {
            throw new IllegalArgumentException("queryCacheSize must not be negative: " + queryCacheSize);
        }

        logger.fine("Lexicon configuration validated: " + this);
    }

    @Override
    public String toString() {
        return "LexiconConfig{" +
                "dawgPath=" + dawgPath +
                ", alphabet=" + alphabetName +
                ", maxWordLength=" + maxWordLength +
                ", maxRackSize=" + maxRackSize +
                ", maxWildcards=" + maxWildcards +
                ", reloadIntervalSeconds=" + reloadIntervalSeconds +
                ", queryCacheSize=" + queryCacheSize +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static class Builder {

        private Path dawgPath = Path.of("lexicon.dawg");
        private String alphabetName = "english";
        private int maxWordLength = MAX_WORD_LENGTH;
        private int maxRackSize = 16;
        private int maxWildcards = 16;
        private long reloadIntervalSeconds = 10;
        private long queryCacheSize = 10_000;

        private Builder() {
        }

        private void applyEnvironmentVariables() {
            getEnv(ENV_DAWG_PATH).ifPresent(val -> this.dawgPath = Path.of(val));
            getEnv(ENV_ALPHABET).ifPresent(val -> this.alphabetName = val);
            getEnvInt(ENV_MAX_WORD_LENGTH).ifPresent(val -> this.maxWordLength = val);
            getEnvInt(ENV_MAX_RACK_SIZE).ifPresent(val -> this.maxRackSize = val);
            getEnvInt(ENV_MAX_WILDCARDS).ifPresent(val -> this.maxWildcards = val);
            getEnvLong(ENV_RELOAD_INTERVAL_SECONDS).ifPresent(val -> this.reloadIntervalSeconds = val);
            getEnvLong(ENV_QUERY_CACHE_SIZE).ifPresent(val -> this.queryCacheSize = val);
        }

        public Builder dawgPath(Path path) {
            this.dawgPath = path;
            return this;
        }

        public Builder alphabet(String name) {
            this.alphabetName = name;
            return this;
        }

        public Builder maxWordLength(int length) {
            this.maxWordLength = length;
            return this;
        }

        public Builder maxRackSize(int size) {
            this.maxRackSize = size;
            return this;
        }

        public Builder maxWildcards(int count) {
            this.maxWildcards = count;
            return this;
        }

        public Builder reloadIntervalSeconds(long seconds) {
            this.reloadIntervalSeconds = seconds;
            return this;
        }

        public Builder queryCacheSize(long size) {
            this.queryCacheSize = size;
            return this;
        }

        public LexiconConfig build() {
            return new LexiconConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT HELPERS
        // ====================================================================

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getProperty(key);
            }
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded setting: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
