package vscope.sema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vscope.scope.ScopeChain;
import vscope.scope.ScopeKind;
import vscope.scope.ScopeLabel;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Follows scope-enter/scope-exit events of the elaborating pass and hands out the
 * {@link ScopeChain} of the current scope. Entered chains share their prefix with the
 * enclosing one, so keeping every intermediate chain around costs one node per scope.
 */
public final class ScopeTracker {
    private static final Logger log = LoggerFactory.getLogger(ScopeTracker.class);

    private final Deque<ScopeChain> scopes = new ArrayDeque<>();

    public ScopeTracker() { this(ScopeChain.EMPTY); }

    public ScopeTracker(ScopeChain base) { scopes.push(base); }

    public ScopeChain enter(ScopeLabel label) {
        ScopeChain next = current().plus(label);
        scopes.push(next);
        log.debug("enter {} ({}) -> {}", label, label.kind(), next);
        return next;
    }

    public ScopeChain enter(String name, ScopeKind kind) {
        return enter(new ScopeLabel(name, kind));
    }

    public ScopeChain enter(String name, ScopeKind kind, int loopIndex) {
        return enter(new ScopeLabel(name, kind, loopIndex));
    }

    public ScopeChain exit() {
        if (scopes.size() == 1) throw new SemanticException("Scope exit without matching enter");
        ScopeChain left = scopes.pop();
        log.debug("exit {}", left);
        return left;
    }

    public ScopeChain current() { return scopes.peek(); }

    /** Number of scopes entered and not yet exited. */
    public int depth() { return scopes.size() - 1; }

    /** Chain naming a signal declared in the current scope; the scope itself is not entered. */
    public ScopeChain signal(String name) {
        return current().plus(new ScopeLabel(name, ScopeKind.SIGNAL));
    }
}
