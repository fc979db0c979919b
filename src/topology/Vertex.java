package topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A graph node: the user payload, its stable index inside the owning graph and
 * the outgoing edges, keyed by target vertex index in insertion order.
 */
public final class Vertex<T> {

    private final T data;
    private final int index;
    private final Map<Integer, Double> adjacent = new LinkedHashMap<>();

    Vertex(T data, int index) {
        this.data = data;
        this.index = index;
    }

    public T getData() {
        return data;
    }

    public int getIndex() {
        return index;
    }

    // inserting the same target again overwrites the weight, keeping the original position
    void addAdjacentVertex(int destination, double weight) {
        adjacent.put(destination, weight);
    }

    void clearAdjacentVertices() {
        adjacent.clear();
    }

    public Map<Integer, Double> getAdjacentIndices() {
        return Collections.unmodifiableMap(adjacent);
    }

    public int getDegree() {
        return adjacent.size();
    }

    @Override
    public String toString() {
        return String.valueOf(data);
    }
}
