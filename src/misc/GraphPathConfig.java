package misc;

import topology.PathFinderFactory;

import java.io.*;
import java.util.*;

/* a .properties file is used to initialize this class with a set of key/value pairs:

graph_file = path of a JSON topology (optional, the built-in sample graph is used when missing)
strategy   = bfs | dijkstra | all
start, end = the endpoints of the query (required with graph_file, A and E for the sample)
debug      = true | false
 */
public class GraphPathConfig {

    public static final String SAMPLE_START = "A";
    public static final String SAMPLE_END = "E";

    private final Properties properties;

    final public String graph_file;
    final public List<PathFinderFactory.Strategy> strategies;
    final public String start;
    final public String end;
    final public boolean debug;

    public GraphPathConfig(String config_file) {
        this(load(config_file));
    }

    public GraphPathConfig(Properties properties) {
        this.properties = properties;

        var file = properties.getProperty("graph_file");
        graph_file = file == null || file.isBlank() ? null : file.trim();

        strategies = parseStrategies(properties.getProperty("strategy", "all"));

        if (graph_file != null) {
            start = getRequiredProperty("start");
            end = getRequiredProperty("end");
        } else {
            start = properties.getProperty("start", SAMPLE_START).trim();
            end = properties.getProperty("end", SAMPLE_END).trim();
        }

        var debug_value = properties.getProperty("debug", "false").trim();
        if (!debug_value.equals("true") && !debug_value.equals("false")) {
            throw new IllegalArgumentException("Parameter debug must be true or false, found: " + debug_value);
        }
        debug = debug_value.equals("true");
    }

    private static Properties load(String config_file) {
        var properties = new Properties();
        try (var reader = new FileReader(config_file)) {
            properties.load(reader);
        } catch (FileNotFoundException e) {
            throw new UncheckedIOException("Config file not found:" + config_file
                    + " (current directory: " + System.getProperty("user.dir") + ")", e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return properties;
    }

    private static List<PathFinderFactory.Strategy> parseStrategies(String value) {
        var key = value.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "all" -> List.of(PathFinderFactory.Strategy.values());
            case "bfs" -> List.of(PathFinderFactory.Strategy.BFS);
            case "dijkstra" -> List.of(PathFinderFactory.Strategy.DIJKSTRA);
            default -> throw new IllegalArgumentException("Unknown strategy: " + value);
        };
    }

    private String getRequiredProperty(String key) {
        var value = properties.getProperty(key);
        if (value == null || value.isBlank())
            throw new IllegalArgumentException("Parameter " + key + " not found!");
        return value.trim();
    }

    public boolean usesSampleGraph() {
        return graph_file == null;
    }

    @Override
    public String toString() {
        return "misc.GraphPathConfig{" +
                "graph_file='" + graph_file + '\'' +
                ", strategies=" + strategies +
                ", start='" + start + '\'' +
                ", end='" + end + '\'' +
                ", debug=" + debug +
                '}';
    }
}
