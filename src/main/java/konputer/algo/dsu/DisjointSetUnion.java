package konputer.algo.dsu;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * Union-find over the elements {@code 0..n-1} with union by size and path compression.
 * Operations run in amortized inverse-Ackermann time. Not thread-safe.
 */
public class DisjointSetUnion {
    private static final Logger logger = LogManager.getLogger(DisjointSetUnion.class);

    private final int[] parent;
    // only meaningful for roots
    private final int[] setSize;
    private int setCount;

    public DisjointSetUnion(int n) {
        checkArgument(n >= 0, "Element count cannot be negative: %s", n);
        parent = new int[n];
        setSize = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
            setSize[i] = 1;
        }
        setCount = n;
        logger.debug("Created disjoint set union over {} elements", n);
    }

    /**
     * Representative of the set containing {@code v}. Every element on the walked path
     * is re-pointed straight at the root.
     */
    public int findSet(int v) {
        checkElementIndex(v, parent.length);
        int root = v;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[v] != root) {
            int next = parent[v];
            parent[v] = root;
            v = next;
        }
        return root;
    }

    /**
     * Merges the sets of {@code a} and {@code b}; the smaller set is attached under the
     * larger one's root.
     *
     * @return false if both were already in the same set
     */
    public boolean unionSets(int a, int b) {
        a = findSet(a);
        b = findSet(b);
        if (a == b) {
            return false;
        }
        if (setSize[a] < setSize[b]) {
            int tmp = a;
            a = b;
            b = tmp;
        }
        parent[b] = a;
        setSize[a] += setSize[b];
        setCount--;
        return true;
    }

    public boolean areConnected(int a, int b) {
        return findSet(a) == findSet(b);
    }

    /** Number of elements in the set containing {@code v}. */
    public int sizeOf(int v) {
        return setSize[findSet(v)];
    }

    public int setCount() {
        return setCount;
    }

    public int size() {
        return parent.length;
    }
}
