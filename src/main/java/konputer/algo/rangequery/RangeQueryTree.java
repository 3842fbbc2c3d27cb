package konputer.algo.rangequery;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jooq.lambda.Seq;
import org.jspecify.annotations.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Segment tree over a fixed-size sequence, answering aggregate queries on inclusive
 * index ranges and accepting single-position updates.
 * <p>
 * Nodes live in an implicit binary tree: the root is slot 1, children of {@code v} are
 * {@code 2v} and {@code 2v + 1}, slot 0 is unused. A node's index range is derived from
 * the recursion and never stored. Build is O(n), query and update are O(log n).
 * <p>
 * Not thread-safe.
 *
 * @param <T> aggregate type
 */
public class RangeQueryTree<T> {
    private static final Logger logger = LogManager.getLogger(RangeQueryTree.class);
    static final int MAX_SIZE = Integer.MAX_VALUE / 4;

    private final int size;
    private final List<T> nodes;
    private final Monoid<T> monoid;

    public RangeQueryTree(@NonNull List<? extends T> values, @NonNull Monoid<T> monoid) {
        checkNotNull(values, "values cannot be null");
        this.monoid = checkNotNull(monoid, "monoid cannot be null");
        checkArgument(values.size() <= MAX_SIZE, "Sequence of %s elements exceeds the maximum of %s", values.size(), MAX_SIZE);
        this.size = values.size();
        this.nodes = new ArrayList<>(Collections.nCopies(4 * size, null));
        if (size > 0) {
            build(values, 1, 0, size - 1);
        }
        logger.debug("Built range query tree over {} elements ({} slots)", size, nodes.size());
    }

    public static <T> RangeQueryTree<T> of(@NonNull Iterable<? extends T> values, @NonNull Monoid<T> monoid) {
        checkNotNull(values, "values cannot be null");
        return new RangeQueryTree<>(Seq.seq(values).toList(), monoid);
    }

    /**
     * Aggregate of the elements at {@code l..r} inclusive, merged left to right.
     *
     * @throws RangeOutOfBoundsException unless {@code 0 <= l <= r < size()}
     */
    public T query(int l, int r) {
        if (l < 0 || r >= size || l > r) {
            throw RangeOutOfBoundsException.forRange(l, r, size);
        }
        return query(1, 0, size - 1, l, r);
    }

    /**
     * Replaces the element at {@code pos}. Only the nodes on the path from the root to
     * that leaf change.
     *
     * @throws RangeOutOfBoundsException unless {@code 0 <= pos < size()}
     */
    public void update(int pos, T value) {
        checkPosition(pos);
        update(1, 0, size - 1, pos, value);
    }

    public T get(int pos) {
        checkPosition(pos);
        return query(1, 0, size - 1, pos, pos);
    }

    /** Aggregate of the whole sequence; the identity when the tree is empty. */
    public T queryAll() {
        return size == 0 ? monoid.identity() : nodes.get(1);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public Monoid<T> monoid() {
        return monoid;
    }

    private void checkPosition(int pos) {
        if (pos < 0 || pos >= size) {
            throw RangeOutOfBoundsException.forPosition(pos, size);
        }
    }

    private void build(List<? extends T> values, int v, int tl, int tr) {
        if (tl == tr) {
            nodes.set(v, values.get(tl));
        } else {
            int tm = tl + (tr - tl) / 2;
            build(values, v * 2, tl, tm);
            build(values, v * 2 + 1, tm + 1, tr);
            pull(v);
        }
    }

    private T query(int v, int tl, int tr, int l, int r) {
        if (l > r) {
            return monoid.identity();
        }
        if (l == tl && r == tr) {
            return nodes.get(v);
        }
        int tm = tl + (tr - tl) / 2;
        // left before right, the merge may not commute
        T left = query(v * 2, tl, tm, l, Math.min(r, tm));
        T right = query(v * 2 + 1, tm + 1, tr, Math.max(l, tm + 1), r);
        return monoid.combine(left, right);
    }

    private void update(int v, int tl, int tr, int pos, T value) {
        if (tl == tr) {
            nodes.set(v, value);
        } else {
            int tm = tl + (tr - tl) / 2;
            if (pos <= tm) {
                update(v * 2, tl, tm, pos, value);
            } else {
                update(v * 2 + 1, tm + 1, tr, pos, value);
            }
            pull(v);
        }
    }

    private void pull(int v) {
        nodes.set(v, monoid.combine(nodes.get(v * 2), nodes.get(v * 2 + 1)));
    }
}
