package vscope.sema;

import vscope.scope.ScopeChain;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Symbols per scope, keyed by {@link ScopeChain}. Lookup starts in the given scope and moves
 * outward through the less qualified chains until a definition is found.
 */
public final class ScopeTable<V> {
    private final Map<ScopeChain, Map<String, V>> scopes = new LinkedHashMap<>();

    public void define(ScopeChain scope, String name, V value) {
        if (value == null) throw new SemanticException("Symbol " + name + " defined without a value in scope " + scope);
        Map<String, V> symbols = scopes.computeIfAbsent(scope, k -> new HashMap<>());
        if (symbols.containsKey(name)) {
            throw new SemanticException("Duplicate symbol: " + name + " in scope " + scope);
        }
        symbols.put(name, value);
    }

    public V getLocal(ScopeChain scope, String name) {
        Map<String, V> symbols = scopes.get(scope);
        return symbols == null ? null : symbols.get(name);
    }

    public V lookup(ScopeChain scope, String name) {
        for (ScopeChain s : scope.lessQualified()) {
            V v = getLocal(s, name);
            if (v != null) return v;
        }
        return null;
    }

    /** Innermost scope defining {@code name}, or null. */
    public ScopeChain resolveScope(ScopeChain scope, String name) {
        for (ScopeChain s : scope.lessQualified()) {
            if (getLocal(s, name) != null) return s;
        }
        return null;
    }

    public Set<ScopeChain> scopes() {
        return Collections.unmodifiableSet(scopes.keySet());
    }
}
