package com.lexigraph.infra.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexigraph.api.model.Alphabet;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Named alphabets available to the builder, the CLI and the query engine.
 *
 * <p>The built-in set is read once from the {@code alphabets.json} classpath
 * resource. Additional registries can be loaded from any file with the same
 * layout:
 * <pre>
 * { "alphabets": [ { "name": "english", "letters": "abc...z", "description": "..." } ] }
 * </pre>
 */
public final class AlphabetRegistry {

    private static final Logger logger = Logger.getLogger(AlphabetRegistry.class.getName());

    static final String RESOURCE = "/alphabets.json";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static volatile AlphabetRegistry builtIn;

    private final Map<String, Alphabet> alphabets;

    private AlphabetRegistry(Map<String, Alphabet> alphabets) {
        this.alphabets = Collections.unmodifiableMap(alphabets);
    }

    /**
     * @return the registry declared by the bundled {@code alphabets.json}
     */
    public static AlphabetRegistry builtIn() {
        AlphabetRegistry registry = builtIn;
        if (registry == null) {
            synchronized (AlphabetRegistry.class) {
                registry = builtIn;
                if (registry == null) {
                    registry = loadResource();
                    builtIn = registry;
                }
            }
        }
        return registry;
    }

    /**
     * Loads a registry from a JSON file.
     *
     * @throws IOException if the file cannot be read or parsed
     * @throws IllegalArgumentException if a declaration is invalid
     */
    public static AlphabetRegistry load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    private static AlphabetRegistry loadResource() {
        try (InputStream in = AlphabetRegistry.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            AlphabetRegistry registry = read(in);
            logger.fine("Loaded built-in alphabets: " + registry.names());
            return registry;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    static AlphabetRegistry read(InputStream in) throws IOException {
        Declarations declarations = objectMapper.readValue(in, Declarations.class);
        Map<String, Alphabet> byName = new LinkedHashMap<>();
        if (declarations.alphabets() != null) {
            for (Declaration declaration : declarations.alphabets()) {
                Alphabet alphabet = Alphabet.of(declaration.name(), declaration.letters());
                if (byName.putIfAbsent(alphabet.name(), alphabet) != null) {
                    throw new IllegalArgumentException("Alphabet '" + alphabet.name() + "' is declared twice");
                }
            }
        }
        return new AlphabetRegistry(byName);
    }

    public Optional<Alphabet> find(String name) {
        return Optional.ofNullable(alphabets.get(name));
    }

    /**
     * @throws IllegalArgumentException if no alphabet has that name
     */
    public Alphabet get(String name) {
        Alphabet alphabet = alphabets.get(name);
        if (alphabet == null) {
            throw new IllegalArgumentException("Unknown alphabet '" + name + "'; known alphabets: " + names());
        }
        return alphabet;
    }

    public Set<String> names() {
        return alphabets.keySet();
    }

    record Declarations(@JsonProperty("alphabets") List<Declaration> alphabets) {
    }

    record Declaration(
            @JsonProperty("name") String name,
            @JsonProperty("letters") String letters,
            @JsonProperty("description") String description) {
    }
}
