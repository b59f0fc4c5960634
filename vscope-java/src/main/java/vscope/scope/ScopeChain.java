package vscope.scope;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Immutable root-to-leaf path of {@link ScopeLabel}s naming one scope of the design hierarchy,
 * e.g. {@code top.sub.gen[2].x}.
 *
 * <p>Chains share their ancestry through a parent-linked backing tree: {@link #plus} is O(1) per
 * label and {@link #slice} never copies nodes. Two chains with equal label sequences are equal
 * and hash alike whether or not they share nodes, so chains work as map keys (wildcard
 * {@link ScopeKind#ANY} labels included).
 */
public final class ScopeChain implements Iterable<ScopeLabel> {
    public static final ScopeChain EMPTY = new ScopeChain();

    private final ScopeWindow window; // null iff empty
    private String rendered;

    public ScopeChain() {
        this.window = null;
    }

    public ScopeChain(List<ScopeLabel> labels) {
        for (ScopeLabel l : labels) {
            if (l == null) throw new ScopeOperandException("Cannot build a scope chain from a null label");
        }
        this.window = ScopeWindow.of(labels);
    }

    public ScopeChain(ScopeChain other) {
        this.window = other.window;
    }

    private ScopeChain(ScopeWindow window) {
        this.window = window;
    }

    public static ScopeChain of(ScopeLabel... labels) {
        return new ScopeChain(Arrays.asList(labels));
    }

    private static ScopeChain wrap(ScopeWindow w) {
        return w == null ? EMPTY : new ScopeChain(w);
    }

    // --- concatenation ---

    public ScopeChain plus(ScopeLabel label) {
        if (label == null) throw new ScopeOperandException("Can not add null to a scope chain");
        return window == null ? wrap(ScopeWindow.single(label)) : wrap(window.append(label));
    }

    public ScopeChain plus(ScopeChain other) {
        if (other == null) throw new ScopeOperandException("Can not add null to a scope chain");
        if (other.window == null) return this;
        if (window == null) return other;
        return wrap(window.extend(other));
    }

    /** Dynamic form of {@code +}: the operand must be a label or a chain. */
    public ScopeChain plus(Object operand) {
        if (operand instanceof ScopeLabel) return plus((ScopeLabel) operand);
        if (operand instanceof ScopeChain) return plus((ScopeChain) operand);
        throw new ScopeOperandException("Can not add " + operand + " to a scope chain");
    }

    // --- access ---

    public int size() {
        return window == null ? 0 : window.length;
    }

    public boolean isEmpty() {
        return window == null;
    }

    /** Negative indices count from the leaf end. */
    public ScopeLabel get(int index) {
        if (window == null) throw new ScopeIndexException("Scope index " + index + " out of range for length 0");
        return window.get(index);
    }

    public ScopeLabel leaf() {
        return get(-1);
    }

    public ScopeChain slice(int low, int high) {
        return slice(low, high, 1);
    }

    /** {@code [low, high)}; negative bounds count from the end, only step 1 is supported. */
    public ScopeChain slice(int low, int high, int step) {
        if (step != 1) {
            throw new ScopeIndexException("ScopeChain can only be sliced with step 1, got " + step);
        }
        int n = size();
        int lo = low < 0 ? low + n : low;
        int hi = high < 0 ? high + n : high;
        if (lo == hi) return EMPTY;
        if (lo < 0 || hi > n || lo > hi) {
            throw new ScopeIndexException("Scope slice [" + low + ":" + high + ") out of range for length " + n);
        }
        return wrap(window.slice(lo, hi, step));
    }

    @Override
    public Iterator<ScopeLabel> iterator() {
        return window == null ? Collections.emptyIterator() : window.iterator();
    }

    public Stream<ScopeLabel> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<ScopeLabel> moduleScopes() {
        List<ScopeLabel> out = new ArrayList<>();
        for (ScopeLabel l : this) {
            if (l.kind() == ScopeKind.MODULE) out.add(l);
        }
        return Collections.unmodifiableList(out);
    }

    // --- rendering ---

    /**
     * Flattens the chain into a single identifier. Non-printable labels contribute nothing
     * themselves, but a {@code for} label with a loop index emits {@code _<index>_} in front of
     * whatever the next label renders.
     */
    public String render() {
        String r = rendered;
        if (r == null) {
            StringBuilder sb = new StringBuilder();
            String pending = null;
            boolean endsWithSeparator = false;
            for (ScopeLabel l : this) {
                if (pending != null) {
                    sb.append(pending);
                    endsWithSeparator = false;
                }
                String code = l.render();
                if (!code.isEmpty()) {
                    sb.append(code).append('_');
                    endsWithSeparator = true;
                }
                pending = (l.kind() == ScopeKind.FOR && l.hasLoopIndex()) ? "_" + l.loopIndex() + "_" : null;
            }
            if (endsWithSeparator) sb.setLength(sb.length() - 1);
            r = sb.toString();
            rendered = r;
        }
        return r;
    }

    public String display() {
        return window == null ? "" : window.display();
    }

    // --- qualification lowering ---

    /**
     * This chain, then the chains obtained by dropping the leaf one at a time, ending with
     * {@link #EMPTY}: {@code size() + 1} chains in total.
     */
    public Iterable<ScopeChain> lessQualified() {
        return this::lessQualifiedIterator;
    }

    public Iterator<ScopeChain> lessQualifiedIterator() {
        return new Iterator<>() {
            private ScopeWindow current = window;
            private boolean first = true;
            private boolean done = false;

            @Override
            public boolean hasNext() { return !done; }

            @Override
            public ScopeChain next() {
                if (done) throw new NoSuchElementException();
                if (current == null) {
                    done = true;
                    return EMPTY;
                }
                ScopeChain c = first ? ScopeChain.this : wrap(current);
                first = false;
                current = current.length == 1 ? null : current.popLeaf();
                return c;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopeChain)) return false;
        ScopeChain other = (ScopeChain) o;
        if (window == null || other.window == null) return window == other.window;
        return window.equals(other.window);
    }

    @Override
    public int hashCode() {
        return window == null ? ScopeWindow.EMPTY_HASH : window.hashCode();
    }

    @Override
    public String toString() { return display(); }
}
