package topology;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

final class WeightedGraphTest {

    private static WeightedGraph<String> graph(String... vertices) {
        var graph = new WeightedGraph<String>();
        for (String v : vertices) graph.addVertex(v);
        return graph;
    }

    @Test
    void addsVerticesInInsertionOrder() {
        var graph = graph("C", "A", "B");

        assertEquals(List.of("C", "A", "B"), graph.getVertices());
        assertEquals(3, graph.getVertexCount());
        assertEquals(0, graph.getEdgeCount());
        assertTrue(graph.containsVertex("A"));
        assertFalse(graph.containsVertex("Z"));
        assertFalse(graph.containsVertex(null));
    }

    @Test
    void edgesAreDirected() {
        var graph = graph("A", "B");
        graph.addEdge("A", "B", 2.5);

        assertEquals(OptionalDouble.of(2.5), graph.getWeight("A", "B"));
        assertEquals(OptionalDouble.empty(), graph.getWeight("B", "A"));
        assertTrue(graph.getAdjacent("B").isEmpty());
        assertEquals(1, graph.getEdgeCount());
    }

    @Test
    void addingSameEdgeOverwritesWeightAndKeepsOrder() {
        var graph = graph("A", "B", "C");
        graph.addEdge("A", "B", 1);
        graph.addEdge("A", "C", 2);
        graph.addEdge("A", "B", 7);

        assertEquals(List.of("B", "C"), List.copyOf(graph.getAdjacent("A").keySet()));
        assertEquals(Map.of("B", 7.0, "C", 2.0), graph.getAdjacent("A"));
        assertEquals(2, graph.getEdgeCount());
    }

    @Test
    void unknownEndpointFailsWithoutMutation() {
        var graph = graph("A", "B");
        graph.addEdge("A", "B", 1);

        var source = assertThrows(IllegalArgumentException.class, () -> graph.addEdge("X", "B", 1));
        assertTrue(source.getMessage().contains("X"));
        assertThrows(IllegalArgumentException.class, () -> graph.addEdge("A", "Y", 1));
        assertThrows(IllegalArgumentException.class, () -> graph.addEdge(new Edge<>("A", null, 1)));

        assertEquals(1, graph.getEdgeCount());
        assertEquals(List.of("A", "B"), graph.getVertices());
        assertEquals(Map.of("B", 1.0), graph.getAdjacent("A"));
    }

    @Test
    void rejectsNegativeAndNonFiniteWeights() {
        var graph = graph("A", "B");

        assertThrows(IllegalArgumentException.class, () -> graph.addEdge("A", "B", -0.5));
        assertThrows(IllegalArgumentException.class, () -> graph.addEdge("A", "B", Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> graph.addEdge("A", "B", Double.POSITIVE_INFINITY));
        assertEquals(0, graph.getEdgeCount());

        graph.addEdge("A", "B", 0.0);
        assertEquals(OptionalDouble.of(0.0), graph.getWeight("A", "B"));
    }

    @Test
    void readdingVertexResetsOutgoingButKeepsIncomingEdges() {
        var graph = graph("A", "B", "C");
        graph.addEdge("A", "B", 1);
        graph.addEdge("B", "C", 1);
        int index = graph.getVertex("B").getIndex();

        graph.addVertex("B");

        assertEquals(index, graph.getVertex("B").getIndex());
        assertTrue(graph.getAdjacent("B").isEmpty());
        assertEquals(OptionalDouble.of(1.0), graph.getWeight("A", "B"));
        assertEquals(3, graph.getVertexCount());
    }

    @Test
    void edgeValuesReflectAdjacency() {
        var graph = graph("A", "B", "C");
        graph.addEdge(new Edge<>("A", "B", 1));
        graph.addEdge(new Edge<>("B", "C", 2));

        assertEquals(List.of(new Edge<>("A", "B", 1.0), new Edge<>("B", "C", 2.0)), graph.edges());
        assertEquals("A: \n(A->B)[1.0]\nB: \n(B->C)[2.0]\nC: \n", graph.toString());
    }

    @Test
    void adjacencyViewIsReadOnly() {
        var graph = graph("A", "B");
        graph.addEdge("A", "B", 1);

        assertThrows(UnsupportedOperationException.class, () -> graph.getAdjacent("A").put("A", 3.0));
        assertThrows(UnsupportedOperationException.class, () -> graph.getVertices().add("C"));
    }

    @Test
    void requireVertexAcceptsOnlyKnownPayloads() {
        var graph = graph("A");

        assertDoesNotThrow(() -> graph.requireVertex("A"));
        var e = assertThrows(IllegalArgumentException.class, () -> graph.requireVertex("B"));
        assertTrue(e.getMessage().contains("B"));
        assertThrows(IllegalArgumentException.class, () -> graph.requireVertex(null));
    }

    @Test
    void unknownVertexLookupFails() {
        var graph = graph("A");

        assertThrows(IllegalArgumentException.class, () -> graph.getVertex("B"));
        assertThrows(IllegalArgumentException.class, () -> graph.getAdjacent("B"));
        assertThrows(NullPointerException.class, () -> graph.addVertex(null));
    }
}
