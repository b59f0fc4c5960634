package vscope.scope;

/**
 * Immutable node of the backing tree. Links point from a scope to its enclosing scope,
 * so any number of chains can share the same ancestry.
 */
final class ScopeNode {
    final ScopeLabel label;
    final ScopeNode parent;
    final int depth;

    ScopeNode(ScopeLabel label, ScopeNode parent) {
        this.label = label;
        this.parent = parent;
        this.depth = parent == null ? 1 : parent.depth + 1;
    }
}
