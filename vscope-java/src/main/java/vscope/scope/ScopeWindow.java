package vscope.scope;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A (root, leaf) view onto the backing tree. {@code root} is the topmost visible node
 * (inclusive) and lies on the parent path of {@code leaf}. Windows are never empty;
 * the empty chain carries no window at all.
 *
 * <p>The display string and the content hash are memoized on first use. Both are pure
 * functions of the label sequence, so an unsynchronized first write is harmless.
 */
final class ScopeWindow {
    static final int EMPTY_HASH = 1;

    final ScopeNode root;
    final ScopeNode leaf;
    final int length;

    private int hash;        // 0 = not computed yet
    private String display;

    private ScopeWindow(ScopeNode root, ScopeNode leaf, int length, int hash) {
        if (leaf.depth - root.depth + 1 != length) {
            throw new IllegalStateException("Window length " + length + " does not match tree depth");
        }
        this.root = root;
        this.leaf = leaf;
        this.length = length;
        this.hash = hash;
    }

    static ScopeWindow single(ScopeLabel label) {
        ScopeNode n = new ScopeNode(label, null);
        return new ScopeWindow(n, n, 1, mix(EMPTY_HASH, label));
    }

    /** Returns null for an empty list. */
    static ScopeWindow of(List<ScopeLabel> labels) {
        if (labels.isEmpty()) return null;
        ScopeWindow w = single(labels.get(0));
        return w.extend(labels.subList(1, labels.size()));
    }

    ScopeWindow append(ScopeLabel label) {
        int h = hash;
        return new ScopeWindow(root, new ScopeNode(label, leaf), length + 1, h == 0 ? 0 : mix(h, label));
    }

    ScopeWindow extend(Iterable<ScopeLabel> labels) {
        ScopeNode node = leaf;
        int n = length;
        for (ScopeLabel l : labels) {
            node = new ScopeNode(l, node);
            n++;
        }
        if (n == length) return this;
        // hash is recomputed in one pass on first use
        return new ScopeWindow(root, node, n, 0);
    }

    /** Bounds are already normalized by the caller; returns null for an empty slice. */
    ScopeWindow slice(int low, int high, int step) {
        if (step != 1) {
            throw new ScopeIndexException("Scope windows can only be sliced with step 1, got " + step);
        }
        if (high == low) return null;
        ScopeNode newLeaf = up(leaf, length - high, low, high);
        ScopeNode newRoot = up(newLeaf, high - low - 1, low, high);
        if (newRoot == root && newLeaf == leaf) return this;
        return new ScopeWindow(newRoot, newLeaf, high - low, 0);
    }

    ScopeLabel get(int index) {
        int i = index < 0 ? length + index : index;
        if (i < 0 || i >= length) {
            throw new ScopeIndexException("Scope index " + index + " out of range for length " + length);
        }
        return up(leaf, length - i - 1, i, i + 1).label;
    }

    ScopeWindow popLeaf() {
        if (length == 1) throw new IllegalStateException("Cannot pop the only label of a window");
        return new ScopeWindow(root, leaf.parent, length - 1, 0);
    }

    private ScopeNode up(ScopeNode from, int steps, int low, int high) {
        ScopeNode n = from;
        for (int i = 0; i < steps; i++) {
            if (n == null || n == root) {
                throw new ScopeIndexException("Scope range [" + low + ":" + high + ") runs past the root");
            }
            n = n.parent;
        }
        return n;
    }

    ScopeLabel[] labels() {
        ScopeLabel[] out = new ScopeLabel[length];
        ScopeNode n = leaf;
        for (int i = length - 1; i >= 0; i--) {
            out[i] = n.label;
            n = n.parent;
        }
        return out;
    }

    /** Root-to-leaf; every call walks the tree again. */
    Iterator<ScopeLabel> iterator() {
        ScopeLabel[] ls = labels();
        return new Iterator<>() {
            private int i = 0;

            @Override
            public boolean hasNext() { return i < ls.length; }

            @Override
            public ScopeLabel next() {
                if (i >= ls.length) throw new NoSuchElementException();
                return ls[i++];
            }
        };
    }

    String display() {
        String d = display;
        if (d == null) {
            StringBuilder sb = new StringBuilder();
            for (ScopeLabel l : labels()) {
                if (sb.length() > 0) sb.append('.');
                sb.append(l.display());
            }
            d = sb.toString();
            display = d;
        }
        return d;
    }

    private static int mix(int h, ScopeLabel label) {
        return 31 * h + label.hashCode();
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = EMPTY_HASH;
            for (ScopeLabel l : labels()) h = mix(h, l);
            hash = h;
        }
        return h;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopeWindow)) return false;
        ScopeWindow other = (ScopeWindow) o;
        if (root == other.root && leaf == other.leaf) return true;
        if (length != other.length || hashCode() != other.hashCode()) return false;
        ScopeNode a = leaf;
        ScopeNode b = other.leaf;
        for (int i = 0; i < length; i++) {
            // shared ancestry up to a shared root
            if (a == b && root == other.root) return true;
            if (!a.label.equals(b.label)) return false;
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public String toString() { return display(); }
}
