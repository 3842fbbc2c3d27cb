package konputer.algo.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * Finds a single cycle in a directed or undirected graph with a three-color DFS.
 * Vertices are {@code 0..n-1}. For undirected graphs the edge leading straight back
 * to the DFS parent is not treated as a cycle. O(V + E). Not thread-safe.
 */
public class CycleDetector {
    private static final Logger logger = LogManager.getLogger(CycleDetector.class);

    private static final byte WHITE = 0;
    private static final byte GRAY = 1;
    private static final byte BLACK = 2;

    private final int n;
    private final boolean undirected;
    private final List<List<Integer>> adj;

    private byte[] color;
    private int[] parent;
    // next adjacency position to visit, per vertex
    private int[] nextEdge;
    private int cycleStart;
    private int cycleEnd;

    public CycleDetector(int n) {
        this(n, false);
    }

    public CycleDetector(int n, boolean undirected) {
        checkArgument(n >= 0, "Vertex count cannot be negative: %s", n);
        this.n = n;
        this.undirected = undirected;
        this.adj = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adj.add(new ArrayList<>());
        }
    }

    /** Adds {@code u -> v}, and {@code v -> u} as well when the graph is undirected. */
    public void addEdge(int u, int v) {
        checkElementIndex(u, n, "vertex");
        checkElementIndex(v, n, "vertex");
        adj.get(u).add(v);
        if (undirected) {
            adj.get(v).add(u);
        }
    }

    /**
     * @return the first cycle found as {@code [start, ..., start]} in traversal order,
     * or an empty list when the graph is acyclic
     */
    public List<Integer> findCycle() {
        color = new byte[n];
        parent = new int[n];
        nextEdge = new int[n];
        Arrays.fill(parent, -1);
        cycleStart = -1;

        for (int v = 0; v < n; v++) {
            if (color[v] == WHITE && dfs(v)) {
                break;
            }
        }
        if (cycleStart == -1) {
            return ImmutableList.of();
        }

        List<Integer> cycle = new ArrayList<>();
        cycle.add(cycleStart);
        for (int v = cycleEnd; v != cycleStart; v = parent[v]) {
            cycle.add(v);
        }
        cycle.add(cycleStart);
        logger.debug("Found cycle of length {} starting at {}", cycle.size() - 1, cycleStart);
        return ImmutableList.copyOf(Lists.reverse(cycle));
    }

    public boolean hasCycle() {
        return !findCycle().isEmpty();
    }

    public boolean isUndirected() {
        return undirected;
    }

    public int size() {
        return n;
    }

    // explicit stack, a long path would overflow a recursive walk
    private boolean dfs(int start) {
        Deque<Integer> stack = new ArrayDeque<>();
        color[start] = GRAY;
        parent[start] = -1;
        stack.push(start);
        while (!stack.isEmpty()) {
            int v = stack.peek();
            List<Integer> neighbours = adj.get(v);
            if (nextEdge[v] == neighbours.size()) {
                color[v] = BLACK;
                stack.pop();
                continue;
            }
            int u = neighbours.get(nextEdge[v]++);
            if (undirected && u == parent[v]) {
                continue;
            }
            if (color[u] == WHITE) {
                color[u] = GRAY;
                parent[u] = v;
                stack.push(u);
            } else if (color[u] == GRAY) {
                // back edge
                cycleEnd = v;
                cycleStart = u;
                return true;
            }
        }
        return false;
    }
}
