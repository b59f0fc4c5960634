package vscope.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vscope.scope.ScopeDefinitionException;
import vscope.scope.ScopeKind;
import vscope.scope.ScopeLabel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads a line-oriented scope event script:
 * <pre>
 * enter &lt;kind&gt; &lt;name&gt; [loopIndex]
 * exit
 * signal &lt;name&gt;
 * </pre>
 * Blank lines and {@code #} comments are skipped.
 */
public final class ScopeEventReader {
    private static final Logger log = LoggerFactory.getLogger(ScopeEventReader.class);
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private ScopeEventReader() {}

    public static List<ScopeEvent> read(Path file) throws IOException {
        return read(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static List<ScopeEvent> read(String source) {
        List<ScopeEvent> events = new ArrayList<>();
        String[] lines = source.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = stripComment(lines[i]).trim();
            if (line.isEmpty()) continue;
            events.add(parseLine(line.split("\\s+"), lineNo));
        }
        log.debug("read {} scope events", events.size());
        return events;
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }

    private static ScopeEvent parseLine(String[] words, int lineNo) {
        switch (words[0]) {
            case "enter" -> {
                if (words.length < 3 || words.length > 4) {
                    throw new ScopeEventException("Expected 'enter <kind> <name> [loop]'", lineNo);
                }
                return new ScopeEvent.Enter(label(words, lineNo), lineNo);
            }
            case "exit" -> {
                if (words.length != 1) throw new ScopeEventException("'exit' takes no arguments", lineNo);
                return new ScopeEvent.Exit(lineNo);
            }
            case "signal" -> {
                if (words.length != 2) throw new ScopeEventException("Expected 'signal <name>'", lineNo);
                return new ScopeEvent.Signal(words[1], lineNo);
            }
            default -> throw new ScopeEventException("Unknown directive '" + words[0] + "'", lineNo);
        }
    }

    private static ScopeLabel label(String[] words, int lineNo) {
        ScopeKind kind;
        try {
            kind = ScopeKind.of(words[1]);
        } catch (ScopeDefinitionException e) {
            throw new ScopeEventException(e.getMessage(), lineNo, e);
        }
        String name = words[2];
        if (words.length == 3) return new ScopeLabel(name, kind);
        String loop = words[3];
        if (!INTEGER.matcher(loop).matches()) return new ScopeLabel(name, kind, loop);
        try {
            return new ScopeLabel(name, kind, Integer.parseInt(loop));
        } catch (NumberFormatException e) {
            throw new ScopeEventException("Loop index out of range: " + loop, lineNo, e);
        }
    }
}
