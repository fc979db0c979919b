package topology;

import java.util.*;

/**
 * In-memory directed graph with real-valued, non-negative edge weights.
 * <p>
 * Vertices live in an index arena: each payload maps to a stable index and adjacency
 * refers to targets by index, so re-adding a payload never orphans incoming edges.
 * Not thread safe: callers must serialize mutation and searches.
 */
public class WeightedGraph<T> {

    private final Map<T, Integer> index_map = new HashMap<>();
    private final List<Vertex<T>> vertices = new ArrayList<>();

    /**
     * Adds a vertex for {@code data}. If the payload is already present its index is kept
     * and its outgoing edges are dropped; edges pointing at it from other vertices survive.
     */
    public void addVertex(T data) {
        Objects.requireNonNull(data, "vertex payload");
        var existing = index_map.get(data);
        if (existing != null) {
            vertices.get(existing).clearAdjacentVertices();
            return;
        }
        int index = vertices.size();
        vertices.add(new Vertex<>(data, index));
        index_map.put(data, index);
    }

    /**
     * Records (or overwrites) the directed edge source->destination.
     *
     * @throws IllegalArgumentException if an endpoint is not in the graph, or the weight is
     *                                  negative, NaN or infinite. The graph is left untouched.
     */
    public void addEdge(T source, T destination, double weight) {
        if (!containsVertex(source)) {
            throw new IllegalArgumentException("Source vertex not found: " + source);
        }
        if (!containsVertex(destination)) {
            throw new IllegalArgumentException("Destination vertex not found: " + destination);
        }
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0) {
            throw new IllegalArgumentException("Invalid weight " + weight + " for edge " + source + "->" + destination);
        }
        vertices.get(index_map.get(source)).addAdjacentVertex(index_map.get(destination), weight);
    }

    public void addEdge(Edge<T> edge) {
        addEdge(edge.source(), edge.destination(), edge.weight());
    }

    public boolean containsVertex(T data) {
        return data != null && index_map.containsKey(data);
    }

    /**
     * @throws IllegalArgumentException if {@code data} is not a vertex of this graph
     */
    public void requireVertex(T data) {
        if (!containsVertex(data)) {
            throw new IllegalArgumentException("Vertex not found: " + data);
        }
    }

    /**
     * @throws IllegalArgumentException if {@code data} is not a vertex of this graph
     */
    public Vertex<T> getVertex(T data) {
        requireVertex(data);
        return vertices.get(index_map.get(data));
    }

    /** Payloads in insertion order. */
    public List<T> getVertices() {
        var list = new ArrayList<T>(vertices.size());
        for (Vertex<T> v : vertices) list.add(v.getData());
        return Collections.unmodifiableList(list);
    }

    /** Neighbours of {@code data} with their weights, in edge insertion order. */
    public Map<T, Double> getAdjacent(T data) {
        var adjacent = new LinkedHashMap<T, Double>();
        for (var entry : getVertex(data).getAdjacentIndices().entrySet()) {
            adjacent.put(vertices.get(entry.getKey()).getData(), entry.getValue());
        }
        return Collections.unmodifiableMap(adjacent);
    }

    public OptionalDouble getWeight(T source, T destination) {
        if (!containsVertex(source) || !containsVertex(destination)) return OptionalDouble.empty();
        var weight = getVertex(source).getAdjacentIndices().get(index_map.get(destination));
        return weight == null ? OptionalDouble.empty() : OptionalDouble.of(weight);
    }

    public List<Edge<T>> edges() {
        var list = new ArrayList<Edge<T>>();
        for (Vertex<T> v : vertices) {
            for (var entry : v.getAdjacentIndices().entrySet()) {
                list.add(new Edge<>(v.getData(), vertices.get(entry.getKey()).getData(), entry.getValue()));
            }
        }
        return list;
    }

    public int getVertexCount() {
        return vertices.size();
    }

    public int getEdgeCount() {
        int count = 0;
        for (Vertex<T> v : vertices) {
            count += v.getDegree();
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();

        for (Vertex<T> v : vertices) {
            builder.append(v.getData()).append(": ");
            for (var entry : v.getAdjacentIndices().entrySet()) {
                builder.append("\n").append(new Edge<>(v.getData(), vertices.get(entry.getKey()).getData(), entry.getValue()));
            }
            builder.append("\n");
        }
        return builder.toString();
    }
}
