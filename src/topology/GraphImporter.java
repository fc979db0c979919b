package topology;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.io.*;
import java.util.function.Consumer;

/**
 * Builds a {@link WeightedGraph} from a JSON topology description:
 * <pre>
 * {"nodes": [{"id": "A"}, ...],
 *  "edges": [{"source": "A", "destination": "B", "weight": 1.5, "bidirectional": false}, ...]}
 * </pre>
 * Weights may be numbers or numeric strings; {@code bidirectional} is optional.
 */
public class GraphImporter {

    public static Consumer<String> Log = System.out::println;

    private final boolean debug;

    public GraphImporter(boolean debug) {
        this.debug = debug;
    }

    private void log(String s) {
        Log.accept("*IMPORT* " + s);
    }

    public WeightedGraph<String> importTopology(String json_file) {
        log("Beginning importing file " + json_file);
        try (var reader = new FileReader(json_file)) {
            var graph = importTopology(reader);
            log("Import completed: " + graph.getVertexCount() + " nodes, " + graph.getEdgeCount() + " edges");
            return graph;
        } catch (FileNotFoundException e) {
            throw new UncheckedIOException("Topology file not found: " + json_file, e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public WeightedGraph<String> importTopology(Reader reader) throws IOException {
        JSONParser parser = new JSONParser();
        Object obj;
        try {
            obj = parser.parse(reader);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Malformed topology JSON: " + e, e);
        }
        if (!(obj instanceof JSONObject jsonObject)) {
            throw new IllegalArgumentException("Topology JSON must be an object");
        }

        var graph = new WeightedGraph<String>();

        for (Object node : requireArray(jsonObject, "nodes")) {
            JSONObject nodeObject = requireObject(node, "node");
            String id = requireString(nodeObject, "id");
            if (graph.containsVertex(id)) {
                log("WARNING: duplicate node " + id + ", outgoing edges reset");
            }
            graph.addVertex(id);
        }
        if (debug) log("Node import ended, importing edges...");

        for (Object edge : requireArray(jsonObject, "edges")) {
            JSONObject edgeObject = requireObject(edge, "edge");
            String source = requireString(edgeObject, "source");
            String destination = requireString(edgeObject, "destination");
            double weight = parseWeight(edgeObject.get("weight"), source, destination);

            graph.addEdge(source, destination, weight);
            if (Boolean.TRUE.equals(edgeObject.get("bidirectional"))) {
                graph.addEdge(destination, source, weight);
            }
            if (debug) log("Edge " + source + "->" + destination + " [" + weight + "]");
        }
        return graph;
    }

    private static JSONArray requireArray(JSONObject object, String key) {
        if (!(object.get(key) instanceof JSONArray array)) {
            throw new IllegalArgumentException("Missing array '" + key + "' in topology JSON");
        }
        return array;
    }

    private static JSONObject requireObject(Object item, String what) {
        if (!(item instanceof JSONObject object)) {
            throw new IllegalArgumentException("Expected a JSON object for " + what + ", found: " + item);
        }
        return object;
    }

    private static String requireString(JSONObject object, String key) {
        if (!(object.get(key) instanceof String value) || value.isBlank()) {
            throw new IllegalArgumentException("Missing string '" + key + "' in " + object.toJSONString());
        }
        return value;
    }

    private static double parseWeight(Object value, String source, String destination) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad weight '" + s + "' for edge " + source + "->" + destination, e);
            }
        }
        throw new IllegalArgumentException("Missing weight for edge " + source + "->" + destination);
    }
}
