package vscope.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vscope.io.ScopeEvent;
import vscope.io.ScopeEventReader;
import vscope.io.ScopeEventReplay;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        if (args.length != 1) {
            System.err.println("Usage: vscope <events.scope>");
            System.exit(2);
        }

        Path input = Path.of(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("No such file: " + input);
            System.exit(2);
        }

        // 1. Read
        List<ScopeEvent> events = ScopeEventReader.read(input);
        System.out.println("[1/2] Reading: " + input + " (" + events.size() + " events)");

        // 2. Replay
        ScopeEventReplay.Result result = ScopeEventReplay.replay(events);
        System.out.println("[2/2] Replay: " + result.signals().size() + " signals, max depth " + result.maxDepth());
        if (result.openScopes() > 0) {
            log.warn("{} scope(s) still open at end of {}", result.openScopes(), input);
        }

        for (ScopeEventReplay.SignalName s : result.signals()) {
            System.out.println("  " + s.display() + " -> " + s.rendered());
        }
    }
}
