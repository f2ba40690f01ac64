package com.lexigraph.compiler;

import com.lexigraph.api.exceptions.InvalidInputException;
import com.lexigraph.api.model.Alphabet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordListReaderTest {

    private final WordListReader reader = new WordListReader(
            Alphabet.of("icelandic", "aábdðeéfghiíjklmnoóprstuúvxyýþæö"));

    @TempDir
    Path tempDir;

    @Test
    void skipsBlankAndCommentLinesAndLowerCases() throws IOException {
        Path file = tempDir.resolve("words.txt");
        Files.writeString(file, "# Icelandic sample\n  Hestur \n\n\t\nÞorp\r\n#ignored\nöl", StandardCharsets.UTF_8);

        assertThat(reader.read(file)).containsExactly("hestur", "þorp", "öl");
    }

    @Test
    void stripsByteOrderMark() throws IOException {
        Path file = tempDir.resolve("bom.txt");
        Files.writeString(file, "﻿dagur\nnótt\n", StandardCharsets.UTF_8);

        assertThat(reader.read(file)).containsExactly("dagur", "nótt");
    }

    @Test
    void namesFileAndLineOfForeignLetter() throws IOException {
        Path file = tempDir.resolve("bad.txt");
        Files.writeString(file, "hestur\n# comment\nzebra\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage(file + ":3: word 'zebra' contains 'z', which is not a letter of alphabet 'icelandic'");
    }

    @Test
    void readsInMemoryLines() {
        List<String> words = reader.read(Arrays.asList("Ás", null, "", "  bað"));

        assertThat(words).containsExactly("ás", "bað");
    }

    @Test
    void inMemoryErrorsUseOneBasedIndex() {
        assertThatThrownBy(() -> reader.read(List.of("ás", "q")))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageStartingWith("<input>:2:");
    }
}
