package screennav.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** Navigation graphs by app id. Graphs are immutable; registering replaces. */
public class GraphRegistry {

    private static final Logger log = LoggerFactory.getLogger(GraphRegistry.class);

    private final Map<String, NavigationGraph> graphs = new ConcurrentHashMap<>();

    public void register(NavigationGraph graph) {
        graphs.put(graph.getAppId(), graph);
        log.info("Registered navigation graph for '{}': {} source screen(s)",
                graph.getAppId(), graph.sourceScreens().size());
    }

    public Optional<NavigationGraph> find(String appId) {
        return Optional.ofNullable(graphs.get(appId));
    }

    /** The registered graph, or an empty one for apps without edges. */
    public NavigationGraph getOrEmpty(String appId) {
        return graphs.getOrDefault(appId, new NavigationGraph(appId, Map.of()));
    }

    public Set<String> appIds() {
        return new TreeSet<>(graphs.keySet());
    }

    /** Number of source screens across all registered graphs. */
    public int totalSourceScreens() {
        return graphs.values().stream().mapToInt(g -> g.sourceScreens().size()).sum();
    }
}
