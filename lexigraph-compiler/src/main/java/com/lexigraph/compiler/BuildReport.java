package com.lexigraph.compiler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Statistics of one dictionary build, written as JSON by the builder CLI.
 *
 * @param alphabet       alphabet name
 * @param sources        input word lists, or {@code <input>} for in-memory builds
 * @param wordsRead      non-blank, non-comment lines read
 * @param wordsAccepted  distinct words in the automaton
 * @param duplicates     repeated words dropped
 * @param removed        words dropped because they are on the removal list
 * @param tooLong        words dropped for exceeding the maximum length
 * @param filtered       words rejected by the word filter
 * @param nodeCount      nodes in the final automaton
 * @param edgeCount      edges in the final automaton
 * @param labelChars     letters over all edge labels
 * @param maxWordLength  longest accepted word
 * @param durationMillis wall time of the whole build
 * @param stageMillis    wall time per stage, in stage order
 */
public record BuildReport(
        @JsonProperty("alphabet") String alphabet,
        @JsonProperty("sources") List<String> sources,
        @JsonProperty("words_read") long wordsRead,
        @JsonProperty("words_accepted") long wordsAccepted,
        @JsonProperty("duplicates") long duplicates,
        @JsonProperty("removed") long removed,
        @JsonProperty("too_long") long tooLong,
        @JsonProperty("filtered") long filtered,
        @JsonProperty("node_count") int nodeCount,
        @JsonProperty("edge_count") int edgeCount,
        @JsonProperty("label_chars") long labelChars,
        @JsonProperty("max_word_length") int maxWordLength,
        @JsonProperty("duration_ms") long durationMillis,
        @JsonProperty("stage_ms") Map<String, Long> stageMillis
) {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson() throws IOException {
        return objectMapper.writeValueAsString(this);
    }

    public void write(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson());
    }

    public static BuildReport read(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), BuildReport.class);
    }
}
