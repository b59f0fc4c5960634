package vscope.io;

import vscope.scope.ScopeChain;
import vscope.sema.ScopeTracker;
import vscope.sema.SemanticException;

import java.util.ArrayList;
import java.util.List;

/** Runs a scope event script through a {@link ScopeTracker} and collects the signal names. */
public final class ScopeEventReplay {

    public record SignalName(ScopeChain scope, String display, String rendered) {}

    public record Result(List<SignalName> signals, int maxDepth, int openScopes) {}

    private ScopeEventReplay() {}

    public static Result replay(List<ScopeEvent> events) {
        ScopeTracker tracker = new ScopeTracker();
        List<SignalName> signals = new ArrayList<>();
        int maxDepth = 0;
        for (ScopeEvent e : events) {
            if (e instanceof ScopeEvent.Enter enter) {
                tracker.enter(enter.label());
                maxDepth = Math.max(maxDepth, tracker.depth());
            } else if (e instanceof ScopeEvent.Exit) {
                try {
                    tracker.exit();
                } catch (SemanticException ex) {
                    throw new ScopeEventException(ex.getMessage(), e.line(), ex);
                }
            } else if (e instanceof ScopeEvent.Signal signal) {
                ScopeChain chain = tracker.signal(signal.name());
                signals.add(new SignalName(chain, chain.display(), chain.render()));
            }
        }
        return new Result(List.copyOf(signals), maxDepth, tracker.depth());
    }
}
