package com.lexigraph.infra.serialization;

import com.lexigraph.api.IAutomatonLoader;
import com.lexigraph.api.exceptions.FormatException;
import com.lexigraph.api.model.Alphabet;
import com.lexigraph.runtime.model.Automaton;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Line-oriented text format for automata.
 *
 * <pre>
 * #lexigraph-dawg 1 alphabet=english letters=abcdefghijklmnopqrstuvwxyz nodes=4
 * 0,0,[ca:1]
 * 1,0,[r:2;t:3]
 * 2,1,[]
 * 3,1,[s:2]
 * </pre>
 *
 * <p>One header line, then one record per node in id order: the id, the final
 * flag and the outgoing edges in collation order. Output is UTF-8 with
 * {@code \n} line endings and depends only on the automaton, so two builds of
 * the same word set produce byte-identical files.
 *
 * <p>Decoding validates everything the runtime relies on and reports the
 * 1-based line of the first offending record. A cycle spans several records
 * and is reported without a line number.
 */
public final class AutomatonCodec implements IAutomatonLoader {

    private static final Logger logger = Logger.getLogger(AutomatonCodec.class.getName());

    public static final String MAGIC = "#lexigraph-dawg";
    public static final int VERSION = 1;

    public byte[] encode(Automaton automaton) {
        Alphabet alphabet = automaton.getAlphabet();
        int nodeCount = automaton.nodeCount();
        StringBuilder sb = new StringBuilder(32 + nodeCount * 16);
        sb.append(MAGIC).append(' ').append(VERSION)
                .append(" alphabet=").append(alphabet.name())
                .append(" letters=").append(alphabet.letters())
                .append(" nodes=").append(nodeCount)
                .append('\n');
        for (int node = 0; node < nodeCount; node++) {
            sb.append(node).append(',').append(automaton.isFinal(node) ? '1' : '0').append(",[");
            for (int e = automaton.firstEdge(node); e < automaton.endEdge(node); e++) {
                if (e > automaton.firstEdge(node)) {
                    sb.append(';');
                }
                sb.append(automaton.label(e)).append(':').append(automaton.target(e));
            }
            sb.append("]\n");
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws FormatException if the data is not a well-formed automaton
     */
    public Automaton decode(byte[] data) {
        String text = new String(data, StandardCharsets.UTF_8);
        String[] lines = text.split("\n", -1);
        int lineCount = lines.length;
        if (lineCount > 0 && lines[lineCount - 1].isEmpty()) {
            lineCount--; // trailing newline
        }
        if (lineCount == 0) {
            throw new FormatException("missing header", 1);
        }

        Header header = parseHeader(stripCr(lines[0]));
        Automaton.Builder builder = new Automaton.Builder(header.alphabet());

        int expectedLines = header.nodeCount() + 1;
        if (lineCount < expectedLines) {
            throw new FormatException("expected " + header.nodeCount() + " node records, found "
                    + (lineCount - 1), lineCount + 1);
        }
        if (lineCount > expectedLines) {
            throw new FormatException("unexpected content after node " + (header.nodeCount() - 1), expectedLines + 1);
        }

        for (int node = 0; node < header.nodeCount(); node++) {
            int lineNumber = node + 2;
            parseRecord(stripCr(lines[node + 1]), node, lineNumber, header, builder);
        }

        try {
            return builder.build();
        } catch (IllegalStateException e) {
            throw new FormatException(e.getMessage(), -1, e);
        }
    }

    public void write(Automaton automaton, Path path) throws IOException {
        byte[] data = encode(automaton);
        Path target = path.toAbsolutePath();
        Path parent = target.getParent();
        Files.createDirectories(parent);
        // A watching reader must never see a partial file, and concurrent writers get distinct temp files.
        Path temp = Files.createTempFile(parent, target.getFileName() + ".", ".tmp");
        try {
            Files.write(temp, data);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.fine(() -> String.format("Wrote %d nodes (%d bytes) to %s", automaton.nodeCount(), data.length, path));
    }

    @Override
    public Automaton load(Path path) throws IOException {
        byte[] data = Files.readAllBytes(path);
        Automaton automaton = decode(data);
        logger.fine(() -> String.format("Loaded %d nodes, %d words from %s",
                automaton.nodeCount(), automaton.getStats().wordCount(), path));
        return automaton;
    }

    // ========================================================================
    // PARSING
    // ========================================================================

    private record Header(Alphabet alphabet, int nodeCount) {
    }

    private static Header parseHeader(String line) {
        String[] tokens = line.split(" ");
        if (tokens.length < 2 || !MAGIC.equals(tokens[0])) {
            throw new FormatException("missing or malformed header; expected '" + MAGIC + " " + VERSION + " ...'", 1);
        }
        if (!String.valueOf(VERSION).equals(tokens[1])) {
            throw new FormatException("unsupported format version '" + tokens[1] + "'", 1);
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 2; i < tokens.length; i++) {
            int eq = tokens[i].indexOf('=');
            if (eq <= 0) {
                throw new FormatException("malformed header field '" + tokens[i] + "'", 1);
            }
            fields.put(tokens[i].substring(0, eq), tokens[i].substring(eq + 1));
        }
        String name = requireField(fields, "alphabet");
        String letters = requireField(fields, "letters");
        String nodes = requireField(fields, "nodes");

        Alphabet alphabet;
        try {
            alphabet = Alphabet.of(name, letters);
        } catch (IllegalArgumentException e) {
            throw new FormatException("invalid alphabet: " + e.getMessage(), 1, e);
        }
        int nodeCount = parseNonNegative(nodes, "node count", 1);
        if (nodeCount == 0) {
            throw new FormatException("node count must be at least 1", 1);
        }
        return new Header(alphabet, nodeCount);
    }

    private static String requireField(Map<String, String> fields, String key) {
        String value = fields.get(key);
        if (value == null || value.isEmpty()) {
            throw new FormatException("header is missing '" + key + "='", 1);
        }
        return value;
    }

    private static void parseRecord(String line, int expectedId, int lineNumber, Header header,
                                    Automaton.Builder builder) {
        int firstComma = line.indexOf(',');
        int secondComma = firstComma < 0 ? -1 : line.indexOf(',', firstComma + 1);
        if (secondComma < 0 || !line.endsWith("]") || line.charAt(secondComma + 1) != '[') {
            throw new FormatException("malformed node record '" + line + "'", lineNumber);
        }

        int id = parseNonNegative(line.substring(0, firstComma), "node id", lineNumber);
        if (id != expectedId) {
            throw new FormatException("expected node id " + expectedId + " but found " + id, lineNumber);
        }

        String flag = line.substring(firstComma + 1, secondComma);
        boolean isFinal;
        if ("1".equals(flag)) {
            isFinal = true;
        } else if ("0".equals(flag)) {
            isFinal = false;
        } else {
            throw new FormatException("final flag must be 0 or 1, found '" + flag + "'", lineNumber);
        }
        builder.addNode(isFinal);

        String edges = line.substring(secondComma + 2, line.length() - 1);
        if (edges.isEmpty()) {
            return;
        }
        Alphabet alphabet = header.alphabet();
        int previousRank = -1;
        for (String edge : edges.split(";", -1)) {
            int colon = edge.indexOf(':');
            if (colon <= 0) {
                throw new FormatException("malformed edge '" + edge + "'", lineNumber);
            }
            String label = edge.substring(0, colon);
            int foreign = alphabet.indexOfForeign(label);
            if (foreign >= 0) {
                throw new FormatException("edge '" + label + "' contains '" + label.charAt(foreign)
                        + "', which is not in alphabet '" + alphabet.name() + "'", lineNumber);
            }
            int target = parseNonNegative(edge.substring(colon + 1), "edge target", lineNumber);
            if (target >= header.nodeCount()) {
                throw new FormatException("edge '" + label + "' points to unknown node " + target, lineNumber);
            }
            int rank = alphabet.rank(label.charAt(0));
            if (rank <= previousRank) {
                throw new FormatException("edges must have distinct first letters in collation order; '"
                        + label + "' is out of place", lineNumber);
            }
            previousRank = rank;
            builder.addEdge(label, target);
        }
    }

    private static int parseNonNegative(String value, String what, int lineNumber) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) {
                throw new FormatException(what + " must not be negative: " + value, lineNumber);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new FormatException("invalid " + what + " '" + value + "'", lineNumber, e);
        }
    }

    private static String stripCr(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
