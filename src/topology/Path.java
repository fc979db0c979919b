package topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** An immutable sequence of vertices from a start to an end, with the cost a finder assigned to it. */
public final class Path<T> {
    public static final String SEPARATOR = " -> ";

    private final List<T> vertices;
    private final double cost;

    public Path(List<T> vertices, double cost) {
        if (vertices == null || vertices.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one vertex");
        }
        this.vertices = List.copyOf(vertices);
        this.cost = cost;
    }

    /**
     * Walks the predecessor chain back from {@code end} until {@code start} and returns the
     * vertices in start to end order. The walk is bounded by {@code max_steps} (the vertex
     * count of the searched graph).
     *
     * @throws IllegalStateException if the chain breaks or loops before reaching {@code start}
     */
    public static <T> List<T> reconstruct(Map<T, T> predecessors, T start, T end, int max_steps) {
        var reversed = new ArrayList<T>();
        T current = end;
        reversed.add(current);

        while (!current.equals(start)) {
            if (reversed.size() >= max_steps) {
                throw new IllegalStateException("Cycle in predecessor chain from " + end + " to " + start);
            }
            current = predecessors.get(current);
            if (current == null) {
                throw new IllegalStateException("Broken predecessor chain from " + end + " to " + start);
            }
            reversed.add(current);
        }
        Collections.reverse(reversed);
        return List.copyOf(reversed);
    }

    public static String toString(List<?> vertices) {
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < vertices.size(); i++) {
            if (i > 0) s.append(SEPARATOR);
            s.append(vertices.get(i));
        }
        return s.toString();
    }

    public List<T> vertices() {
        return vertices;
    }

    public T getStart() {
        return vertices.get(0);
    }

    public T getEnd() {
        return vertices.get(vertices.size() - 1);
    }

    /** Number of edges. */
    public int getSize() {
        return vertices.size() - 1;
    }

    public double getCost() {
        return cost;
    }

    @Override public String toString() {
        return toString(vertices);
    }
    @Override public int hashCode()     { return Objects.hash(vertices, cost); }
    @Override public boolean equals(Object o) {
        return o instanceof Path<?> p && vertices.equals(p.vertices) && Double.compare(cost, p.cost) == 0;
    }
}
