package com.lexigraph.compiler;

import com.lexigraph.api.exceptions.InvalidInputException;
import com.lexigraph.api.model.Alphabet;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads plain UTF-8 word lists, one word per line.
 *
 * <p>Lines are trimmed; blank lines and lines starting with {@code #} are
 * skipped. Every other line is lower-cased and must consist only of letters of
 * the alphabet.
 */
public final class WordListReader {

    private final Alphabet alphabet;

    public WordListReader(Alphabet alphabet) {
        this.alphabet = alphabet;
    }

    /**
     * @return the normalized words of the file, in file order
     * @throws InvalidInputException naming the file and line of the first bad word
     */
    public List<String> read(Path path) throws IOException {
        List<String> words = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                    line = line.substring(1); // byte order mark
                }
                String word = normalize(line, path.toString(), lineNumber);
                if (word != null) {
                    words.add(word);
                }
            }
        }
        return words;
    }

    /**
     * Normalizes an in-memory word list.
     */
    public List<String> read(Iterable<String> lines) {
        List<String> words = new ArrayList<>();
        int index = 0;
        for (String line : lines) {
            index++;
            String word = normalize(line, "<input>", index);
            if (word != null) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * @return the normalized word, or null for a blank or comment line
     */
    String normalize(String line, String source, int lineNumber) {
        if (line == null) {
            return null;
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.charAt(0) == '#') {
            return null;
        }
        String word = alphabet.normalize(trimmed);
        int foreign = alphabet.indexOfForeign(word);
        if (foreign >= 0) {
            throw new InvalidInputException(source + ":" + lineNumber + ": word '" + trimmed + "' contains '"
                    + word.charAt(foreign) + "', which is not a letter of alphabet '" + alphabet.name() + "'");
        }
        return word;
    }
}
