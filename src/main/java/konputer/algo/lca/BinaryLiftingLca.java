package konputer.algo.lca;

import com.google.common.math.IntMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NonNull;

import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lowest common ancestor queries on a rooted tree using binary lifting.
 * <p>
 * {@code up[v][i]} is the {@code 2^i}-th ancestor of {@code v}; the root is its own
 * parent. Preprocessing is O(n log n), each query O(log n).
 */
public class BinaryLiftingLca {
    private static final Logger logger = LogManager.getLogger(BinaryLiftingLca.class);

    private final int root;
    private final int levels;
    private final int[] depth;
    private final int[][] up;

    /**
     * @param n     vertex count, vertices are {@code 0..n-1}
     * @param edges undirected tree edges as {@code {u, v}} pairs, exactly {@code n - 1} of them
     * @param root  root vertex
     */
    public BinaryLiftingLca(int n, @NonNull List<int[]> edges, int root) {
        checkArgument(n >= 1, "Tree must have at least one vertex: %s", n);
        checkNotNull(edges, "edges cannot be null");
        checkArgument(edges.size() == n - 1, "Tree on %s vertices needs %s edges, got %s", n, n - 1, edges.size());
        checkElementIndex(root, n, "root");

        List<List<Integer>> adj = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adj.add(new ArrayList<>());
        }
        for (int[] edge : edges) {
            checkArgument(edge != null && edge.length == 2, "Edge must be a {u, v} pair");
            checkElementIndex(edge[0], n, "edge endpoint");
            checkElementIndex(edge[1], n, "edge endpoint");
            adj.get(edge[0]).add(edge[1]);
            adj.get(edge[1]).add(edge[0]);
        }

        this.root = root;
        this.levels = IntMath.log2(n, RoundingMode.CEILING) + 1;
        this.depth = new int[n];
        this.up = new int[n][levels];
        preprocess(adj);
        logger.debug("Preprocessed tree of {} vertices rooted at {} with {} lifting levels", n, root, levels);
    }

    // explicit stack, a path-shaped tree would overflow a recursive walk
    private void preprocess(List<List<Integer>> adj) {
        int n = depth.length;
        boolean[] visited = new boolean[n];
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        visited[root] = true;
        up[root][0] = root;
        int reached = 0;
        while (!stack.isEmpty()) {
            int node = stack.pop();
            reached++;
            // parent row is complete before any child is pushed
            for (int i = 1; i < levels; i++) {
                up[node][i] = up[up[node][i - 1]][i - 1];
            }
            for (int child : adj.get(node)) {
                if (!visited[child]) {
                    visited[child] = true;
                    depth[child] = depth[node] + 1;
                    up[child][0] = node;
                    stack.push(child);
                }
            }
        }
        checkArgument(reached == n, "Edges do not form a connected tree: reached %s of %s vertices", reached, n);
    }

    public int lca(int u, int v) {
        checkVertex(u);
        checkVertex(v);
        if (depth[u] < depth[v]) {
            int tmp = u;
            u = v;
            v = tmp;
        }
        u = lift(u, depth[u] - depth[v]);
        if (u == v) {
            return u;
        }
        for (int i = levels - 1; i >= 0; i--) {
            if (up[u][i] != up[v][i]) {
                u = up[u][i];
                v = up[v][i];
            }
        }
        return up[u][0];
    }

    public int depth(int v) {
        checkVertex(v);
        return depth[v];
    }

    /** The ancestor {@code k} steps above {@code v}; the root once {@code k >= depth(v)}. */
    public int kthAncestor(int v, int k) {
        checkVertex(v);
        checkArgument(k >= 0, "Ancestor distance cannot be negative: %s", k);
        if (k >= depth[v]) {
            return root;
        }
        return lift(v, k);
    }

    /** Number of edges on the path between {@code u} and {@code v}. */
    public int distance(int u, int v) {
        return depth(u) + depth(v) - 2 * depth[lca(u, v)];
    }

    public int root() {
        return root;
    }

    public int size() {
        return depth.length;
    }

    private int lift(int v, int k) {
        for (int i = 0; k > 0; i++, k >>= 1) {
            if ((k & 1) != 0) {
                v = up[v][i];
            }
        }
        return v;
    }

    private void checkVertex(int v) {
        checkElementIndex(v, depth.length, "vertex");
    }
}
