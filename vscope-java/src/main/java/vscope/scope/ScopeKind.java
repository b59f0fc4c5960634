package vscope.scope;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum ScopeKind {
    // printable
    MODULE("module", true),
    BLOCK("block", true),
    SIGNAL("signal", true),
    FUNCTIONCALL("functioncall", true),

    // non-printable
    GENERATE("generate", false),
    ALWAYS("always", false),
    FUNCTION("function", false),
    TASK("task", false),
    TASKCALL("taskcall", false),
    INITIAL("initial", false),
    FOR("for", false),
    WHILE("while", false),
    IF("if", false),

    // wildcard, matches every other kind
    ANY("any", true);

    private static final Map<String, ScopeKind> byName = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ScopeKind::keyword, Function.identity()));

    private final String keyword;
    private final boolean printable;

    ScopeKind(String keyword, boolean printable) {
        this.keyword = keyword;
        this.printable = printable;
    }

    public String keyword() { return keyword; }

    public boolean isPrintable() { return printable; }

    public boolean isWildcard() { return this == ANY; }

    public boolean matches(ScopeKind other) {
        return this == other || this == ANY || other == ANY;
    }

    public static ScopeKind of(String keyword) {
        ScopeKind k = keyword == null ? null : byName.get(keyword);
        if (k == null) throw new ScopeDefinitionException("No such scope kind: " + keyword);
        return k;
    }

    @Override
    public String toString() { return keyword; }
}
