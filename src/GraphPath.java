import misc.GraphPathConfig;
import topology.*;

import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Consumer;

public class GraphPath {

    public static Consumer<String> Log = System.out::println;

    private final GraphPathConfig config;

    public GraphPath(GraphPathConfig config) {
        this.config = config;
    }

    private void log(String s) {
        if (config.debug) Log.accept("*DEBUG* " + s);
    }

    /** The five vertex graph used when no topology file is configured. */
    public static WeightedGraph<String> sampleGraph() {
        var graph = new WeightedGraph<String>();
        for (String v : new String[]{"A", "B", "C", "D", "E"}) {
            graph.addVertex(v);
        }
        graph.addEdge("A", "B", 1);
        graph.addEdge("A", "C", 4);
        graph.addEdge("B", "C", 2);
        graph.addEdge("B", "D", 5);
        graph.addEdge("C", "D", 3);
        graph.addEdge("C", "E", 6);
        graph.addEdge("D", "E", 1);
        return graph;
    }

    public void run() {
        log("Using configuration " + config);
        WeightedGraph<String> graph = config.usesSampleGraph()
                ? sampleGraph()
                : new GraphImporter(config.debug).importTopology(config.graph_file);
        log("Graph:\n" + graph);

        for (var strategy : config.strategies) {
            var finder = PathFinderFactory.of(strategy, graph);
            System.out.println(" -- " + strategy.name().toLowerCase(Locale.ROOT) + " " + config.start + " to " + config.end + " ------------------");
            var path = finder.findPath(config.start, config.end);
            if (path.isPresent()) {
                System.out.println(path.get() + " COST: " + path.get().getCost());
            }
            else System.out.println("NO PATH FOUND");
        }
    }

    public static void main(String[] args) {

        if (args.length > 1) {
            System.out.println("Usage: GraphPath [config file]");
            System.exit(-1);
        }

        try {
            var config = args.length == 1 ? new GraphPathConfig(args[0]) : new GraphPathConfig(new Properties());
            new GraphPath(config).run();
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.println("ERROR: " + e.getMessage());
            System.exit(1);
        }
    }
}
