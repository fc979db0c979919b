package topology;

import java.util.*;

/* -------------------------------------------------------------------------
 * Dijkstra  –  label setting with a linear scan for the closest vertex
 *
 * Idea:      Keep a tentative distance for every reached vertex; settle the
 *            unvisited vertex with the smallest one and relax its edges.
 *            Unreached vertices simply have no distance yet.
 *
 * Result:    One minimum-weight path.  Ties on distance go to the vertex
 *            inserted first in the graph.
 *
 * Limitation:O(V^2) per run, fine for small graphs.  Weights must be
 *            non-negative, which WeightedGraph enforces on insertion.
 * -------------------------------------------------------------------------*/
public class DijkstraSearch<T> implements PathFinder<T> {

    private final WeightedGraph<T> graph;

    public DijkstraSearch(WeightedGraph<T> graph) {
        this.graph = Objects.requireNonNull(graph);
    }

    @Override
    public Optional<List<T>> execute(T start, T end) {
        graph.requireVertex(start);
        graph.requireVertex(end);

        var distance = new HashMap<T, Double>();
        var unvisited = new LinkedHashSet<T>(graph.getVertices());
        var predecessors = new HashMap<T, T>();

        distance.put(start, 0.0);

        while (!unvisited.isEmpty()) {
            var closest = findClosestUnvisited(unvisited, distance);
            // whatever is left cannot be reached from start
            if (closest.isEmpty()) break;

            var current = closest.get();
            if (current.equals(end)) {
                return Optional.of(Path.reconstruct(predecessors, start, end, graph.getVertexCount()));
            }
            unvisited.remove(current);

            double current_distance = distance.get(current);
            for (var entry : graph.getAdjacent(current).entrySet()) {
                var neighbor = entry.getKey();
                double tentative = current_distance + entry.getValue();
                var known = distance.get(neighbor);

                if (known == null || tentative < known) {
                    distance.put(neighbor, tentative);
                    predecessors.put(neighbor, current);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<T> findClosestUnvisited(Set<T> unvisited, Map<T, Double> distance) {
        T closest = null;
        double min = Double.POSITIVE_INFINITY;

        for (T vertex : unvisited) {
            var d = distance.get(vertex);
            if (d != null && (closest == null || d < min)) {
                closest = vertex;
                min = d;
            }
        }
        return Optional.ofNullable(closest);
    }

    /** Summed edge weight along {@code path}. */
    @Override
    public double totalCost(List<T> path) {
        double total = 0.0;
        for (int i = 1; i < path.size(); i++) {
            var from = path.get(i - 1);
            var to = path.get(i);
            total += graph.getWeight(from, to)
                    .orElseThrow(() -> new IllegalArgumentException("No edge " + from + "->" + to));
        }
        return total;
    }
}
