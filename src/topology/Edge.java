package topology;

/**
 * A directed weighted connection between two payloads.
 * Used to build or inspect a {@link WeightedGraph}; the graph does not retain these values.
 */
public record Edge<T>(T source, T destination, double weight) {
    @Override
    public String toString() {
        return "(" + source + "->" + destination + ")[" + weight + "]";
    }
}
