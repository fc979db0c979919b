package topology;

public final class PathFinderFactory {
    private PathFinderFactory() {}
    public enum Strategy { BFS, DIJKSTRA }

    public static <T> PathFinder<T> of(Strategy s, WeightedGraph<T> graph) {
        return switch (s) {
            case BFS      -> new BreadthFirstSearch<>(graph);
            case DIJKSTRA -> new DijkstraSearch<>(graph);
        };
    }
}
