package vscope.scope;

import java.util.Objects;

/**
 * One segment of a scope path: a name, a {@link ScopeKind} and an optional loop index
 * (an {@code Integer} or a {@code String}, e.g. a genvar value or a generate-for label).
 *
 * <p>Equality ignores the kind when either side is {@link ScopeKind#ANY}, so the hash is
 * computed from the name and loop index only.
 */
public final class ScopeLabel {
    private final String name;
    private final ScopeKind kind;
    private final Object loopIndex;

    public ScopeLabel(String name) {
        this(name, ScopeKind.ANY);
    }

    public ScopeLabel(String name, ScopeKind kind) {
        this(name, kind, (Object) null);
    }

    public ScopeLabel(String name, ScopeKind kind, int loopIndex) {
        this(name, kind, (Object) loopIndex);
    }

    public ScopeLabel(String name, ScopeKind kind, String loopIndex) {
        this(name, kind, (Object) loopIndex);
    }

    private ScopeLabel(String name, ScopeKind kind, Object loopIndex) {
        if (name == null) throw new ScopeDefinitionException("Scope name must not be null");
        if (kind == null) throw new ScopeDefinitionException("No such scope kind: null");
        this.name = name;
        this.kind = kind;
        this.loopIndex = loopIndex;
    }

    public static ScopeLabel of(String name, String kind) {
        return new ScopeLabel(name, ScopeKind.of(kind));
    }

    public static ScopeLabel of(String name, String kind, int loopIndex) {
        return new ScopeLabel(name, ScopeKind.of(kind), loopIndex);
    }

    public static ScopeLabel of(String name, String kind, String loopIndex) {
        return new ScopeLabel(name, ScopeKind.of(kind), loopIndex);
    }

    public String name() { return name; }

    public ScopeKind kind() { return kind; }

    /** Integer, String or null. */
    public Object loopIndex() { return loopIndex; }

    public boolean hasLoopIndex() { return loopIndex != null; }

    public boolean isPrintable() { return kind.isPrintable(); }

    /** Name as it appears in a flattened identifier; empty for non-printable kinds. */
    public String render() {
        return kind.isPrintable() ? name : "";
    }

    public String display() {
        return loopIndex == null ? name : name + "[" + loopIndex + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopeLabel)) return false;
        ScopeLabel other = (ScopeLabel) o;
        return name.equals(other.name)
                && Objects.equals(loopIndex, other.loopIndex)
                && kind.matches(other.kind);
    }

    @Override
    public int hashCode() {
        // kind excluded: labels equal through ANY must land in the same bucket
        return 31 * name.hashCode() + Objects.hashCode(loopIndex);
    }

    @Override
    public String toString() { return display(); }
}
