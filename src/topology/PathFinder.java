package topology;

import java.util.List;
import java.util.Optional;

/**
 * A shortest-path strategy bound to one {@link WeightedGraph}. Implementations never mutate the graph.
 */
public interface PathFinder<T> {

    /**
     * @return the vertices from {@code start} to {@code end} inclusive, or empty when {@code end}
     * is unreachable
     * @throws IllegalArgumentException if {@code start} or {@code end} is not a vertex of the graph
     */
    Optional<List<T>> execute(T start, T end);

    // this is to be intended as the cost function that the finder tries to minimize
    double totalCost(List<T> path);

    default Optional<Path<T>> findPath(T start, T end) {
        return execute(start, end).map(vertices -> new Path<>(vertices, totalCost(vertices)));
    }
}
