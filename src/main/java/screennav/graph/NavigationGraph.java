package screennav.graph;

import screennav.model.AppCatalog;
import screennav.model.NavigationEdge;
import screennav.model.SafeStateContext;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph of screen transitions for one app, plus the app's
 * safe-state contexts. Immutable once built.
 *
 * <p>Screens are identified by signature screen id. A screen with no entry
 * simply has no outgoing edges.
 */
public final class NavigationGraph {

    private final String                              appId;
    private final Map<String, List<NavigationEdge>>   edges;
    private final Map<String, SafeStateContext>       contexts;
    private final String                              defaultContext;

    public NavigationGraph(String appId,
                           Map<String, List<NavigationEdge>> edges,
                           List<SafeStateContext> contexts,
                           String defaultContext) {
        this.appId = appId;

        Map<String, List<NavigationEdge>> e = new LinkedHashMap<>();
        edges.forEach((from, list) -> e.put(from, List.copyOf(list)));
        this.edges = Collections.unmodifiableMap(e);

        Map<String, SafeStateContext> c = new LinkedHashMap<>();
        for (SafeStateContext ctx : contexts) {
            if (c.put(ctx.name(), ctx) != null) {
                throw new IllegalArgumentException("Duplicate safe-state context '" + ctx.name() + "' for app " + appId);
            }
        }
        this.contexts = Collections.unmodifiableMap(c);

        if (defaultContext != null && !c.containsKey(defaultContext)) {
            throw new IllegalArgumentException(
                    "Default context '" + defaultContext + "' is not declared for app " + appId);
        }
        this.defaultContext = defaultContext;
    }

    public NavigationGraph(String appId, Map<String, List<NavigationEdge>> edges) {
        this(appId, edges, List.of(), null);
    }

    public static NavigationGraph fromCatalog(AppCatalog catalog) {
        return new NavigationGraph(catalog.getAppId(), catalog.getGraph(),
                catalog.getSafeStateContexts(), catalog.getDefaultContext());
    }

    public String getAppId() {
        return appId;
    }

    /** Outgoing edges of {@code screenId}, empty for unlisted screens. */
    public List<NavigationEdge> edgesFrom(String screenId) {
        return edges.getOrDefault(screenId, List.of());
    }

    /** Screens that have at least one declared outgoing edge list. */
    public Set<String> sourceScreens() {
        return edges.keySet();
    }

    /** Sources, destinations and the given safe states (which may be isolated). */
    public Set<String> allScreens(Collection<String> declaredSafeStates) {
        Set<String> all = new LinkedHashSet<>(edges.keySet());
        edges.values().forEach(list -> list.forEach(edge -> all.add(edge.getToScreen())));
        all.addAll(declaredSafeStates);
        return all;
    }

    public Map<String, List<NavigationEdge>> asMap() {
        return edges;
    }

    public boolean hasPath(String from, String to) {
        return Pathfinder.findPath(this, from, to).isPresent();
    }

    public Optional<SafeStateContext> getContext(String name) {
        return Optional.ofNullable(contexts.get(name));
    }

    public Collection<SafeStateContext> getContexts() {
        return contexts.values();
    }

    public Optional<SafeStateContext> getDefaultContext() {
        return defaultContext == null ? Optional.empty() : getContext(defaultContext);
    }

    @Override
    public String toString() {
        return String.format("NavigationGraph{app='%s', sources=%d, contexts=%s}",
                appId, edges.size(), contexts.keySet());
    }
}
