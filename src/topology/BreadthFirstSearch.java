package topology;

import java.util.*;

/* -------------------------------------------------------------------------
 * Breadth-first search  –  one parent per vertex, hop oriented
 *
 * Idea:      Traverse layer-by-layer with a FIFO queue; mark a vertex the
 *            first time it is reached and remember who reached it.  Stop
 *            when the destination is dequeued.
 *
 * Result:    One minimum-hop path.  Among equal-hop paths the first one
 *            discovered wins, following edge insertion order.
 *
 * Limitation:Edge weights are ignored.
 * -------------------------------------------------------------------------*/
public class BreadthFirstSearch<T> implements PathFinder<T> {

    private final WeightedGraph<T> graph;

    public BreadthFirstSearch(WeightedGraph<T> graph) {
        this.graph = Objects.requireNonNull(graph);
    }

    @Override
    public Optional<List<T>> execute(T start, T end) {
        graph.requireVertex(start);
        graph.requireVertex(end);

        var visited = new HashSet<T>();
        var queue = new ArrayDeque<T>();
        var predecessors = new HashMap<T, T>();

        visited.add(start);
        queue.add(start);

        while (!queue.isEmpty()) {
            var current = queue.poll();

            if (current.equals(end)) {
                return Optional.of(Path.reconstruct(predecessors, start, end, graph.getVertexCount()));
            }

            for (T next : graph.getAdjacent(current).keySet()) {
                if (visited.add(next)) {
                    predecessors.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }

    /** Number of edges along {@code path}; every hop must be an edge of the graph. */
    @Override
    public double totalCost(List<T> path) {
        int hops = 0;
        for (int i = 1; i < path.size(); i++) {
            var from = path.get(i - 1);
            var to = path.get(i);
            if (graph.getWeight(from, to).isEmpty()) {
                throw new IllegalArgumentException("No edge " + from + "->" + to);
            }
            hops++;
        }
        return hops;
    }
}
