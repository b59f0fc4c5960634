package vscope.scope;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeWindowTest {

    private static ScopeLabel m(String name) { return new ScopeLabel(name, ScopeKind.MODULE); }

    private static List<ScopeLabel> list(ScopeWindow w) {
        List<ScopeLabel> out = new ArrayList<>();
        w.iterator().forEachRemaining(out::add);
        return out;
    }

    @Test
    void append_shares_parent_node() {
        ScopeWindow base = ScopeWindow.single(m("top"));
        ScopeWindow a = base.append(m("a"));
        ScopeWindow b = base.append(m("b"));

        assertSame(base.leaf, a.leaf.parent);
        assertSame(base.leaf, b.leaf.parent);
        assertSame(base.root, a.root);
        assertEquals(1, base.length);
        assertEquals(2, a.length);
        assertEquals(2, a.leaf.depth);
    }

    @Test
    void slice_reuses_existing_nodes() {
        ScopeWindow w = ScopeWindow.of(List.of(m("a"), m("b"), m("c"), m("d")));
        ScopeWindow mid = w.slice(1, 3, 1);

        assertEquals(List.of(m("b"), m("c")), list(mid));
        assertSame(w.leaf.parent, mid.leaf);
        assertSame(w.leaf.parent.parent, mid.root);
        assertNull(w.slice(2, 2, 1));
        assertSame(w, w.slice(0, 4, 1));
    }

    @Test
    void slice_rejects_non_unit_step() {
        ScopeWindow w = ScopeWindow.of(List.of(m("a"), m("b")));
        assertThrows(ScopeIndexException.class, () -> w.slice(0, 2, 2));
    }

    @Test
    void slice_past_root_fails() {
        ScopeWindow w = ScopeWindow.of(List.of(m("a"), m("b"), m("c"))).slice(1, 3, 1);
        assertThrows(ScopeIndexException.class, () -> w.slice(0, 3, 1));
    }

    @Test
    void get_walks_from_leaf() {
        ScopeWindow w = ScopeWindow.of(List.of(m("a"), m("b"), m("c")));
        assertEquals(m("a"), w.get(0));
        assertEquals(m("c"), w.get(2));
        assertEquals(m("c"), w.get(-1));
        assertEquals(m("a"), w.get(-3));
        assertThrows(ScopeIndexException.class, () -> w.get(3));
        assertThrows(ScopeIndexException.class, () -> w.get(-4));
    }

    @Test
    void pop_leaf_shrinks_by_one() {
        ScopeWindow w = ScopeWindow.of(List.of(m("a"), m("b")));
        ScopeWindow p = w.popLeaf();
        assertEquals(List.of(m("a")), list(p));
        assertThrows(IllegalStateException.class, p::popLeaf);
    }

    @Test
    void extend_by_nothing_returns_same_window() {
        ScopeWindow w = ScopeWindow.single(m("a"));
        assertSame(w, w.extend(List.of()));
    }

    @Test
    void iteration_restarts_per_call() {
        ScopeWindow w = ScopeWindow.of(List.of(m("a"), m("b")));
        Iterator<ScopeLabel> first = w.iterator();
        first.next();
        assertEquals(List.of(m("a"), m("b")), list(w));
        assertEquals(m("b"), first.next());
        assertFalse(first.hasNext());
    }

    @Test
    void incremental_hash_matches_recomputed_hash() {
        ScopeWindow appended = ScopeWindow.single(m("a")).append(m("b")).append(m("c"));
        ScopeWindow extended = ScopeWindow.single(m("a")).extend(List.of(m("b"), m("c")));
        ScopeWindow sliced = ScopeWindow.of(List.of(m("x"), m("a"), m("b"), m("c"))).slice(1, 4, 1);

        assertEquals(appended.hashCode(), extended.hashCode());
        assertEquals(appended.hashCode(), sliced.hashCode());
        assertEquals(appended, extended);
        assertEquals(appended, sliced);
    }

    @Test
    void display_joins_labels_with_dots() {
        ScopeWindow w = ScopeWindow.of(List.of(m("top"), new ScopeLabel("g", ScopeKind.FOR, 2), m("x")));
        assertEquals("top.g[2].x", w.display());
        assertSame(w.display(), w.display());
    }
}
