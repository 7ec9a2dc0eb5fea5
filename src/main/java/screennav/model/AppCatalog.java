package screennav.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static per-application configuration: screen signatures, the navigation
 * graph and the safe-state contexts. Loaded once at startup by
 * {@link CatalogIO}.
 *
 * <p>Example JSON:
 * <pre>{@code
 * {
 *   "schemaVersion": "1.0",
 *   "appId": "instagram",
 *   "signatures": [ { "screenId": "home_feed", "unique": [":id/row_feed_button_like"] } ],
 *   "graph": {
 *     "home_feed": [ { "toScreen": "explore_grid",
 *                      "actions": [ { "type": "click_by_label", "label": "Search and explore" } ] } ]
 *   },
 *   "safeStateContexts": [ { "name": "warmup", "preferred": "explore_grid", "targets": ["reel_viewing"] } ],
 *   "defaultContext": "warmup"
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AppCatalog {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    @JsonProperty("schemaVersion")
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    @JsonProperty("appId")
    private String appId;

    @JsonProperty("description")
    private String description;

    @JsonProperty("signatures")
    private List<ScreenSignature> signatures = new ArrayList<>();

    /** Outgoing edges keyed by source screen. Order is preserved (LinkedHashMap). */
    @JsonProperty("graph")
    private Map<String, List<NavigationEdge>> graph = new LinkedHashMap<>();

    @JsonProperty("safeStateContexts")
    private List<SafeStateContext> safeStateContexts = new ArrayList<>();

    @JsonProperty("defaultContext")
    private String defaultContext;

    public AppCatalog() {}

    public AppCatalog(String appId) {
        this.appId = appId;
    }

    @JsonIgnore
    public boolean isVersionSupported() {
        return CURRENT_SCHEMA_VERSION.equals(schemaVersion);
    }

    /** Signatures bound to this catalog's app id. */
    public List<ScreenSignature> boundSignatures() {
        return signatures.stream().map(s -> s.withAppId(appId)).toList();
    }

    public String                            getSchemaVersion()     { return schemaVersion; }
    public String                            getAppId()             { return appId; }
    public String                            getDescription()       { return description; }
    public List<ScreenSignature>             getSignatures()        { return signatures; }
    public Map<String, List<NavigationEdge>> getGraph()             { return graph; }
    public List<SafeStateContext>            getSafeStateContexts() { return safeStateContexts; }
    public String                            getDefaultContext()    { return defaultContext; }

    public void setSchemaVersion(String v)                        { this.schemaVersion = v; }
    public void setAppId(String appId)                            { this.appId = appId; }
    public void setDescription(String d)                          { this.description = d; }
    public void setSignatures(List<ScreenSignature> s)            { this.signatures = s != null ? s : new ArrayList<>(); }
    public void setGraph(Map<String, List<NavigationEdge>> g)     { this.graph = g != null ? g : new LinkedHashMap<>(); }
    public void setSafeStateContexts(List<SafeStateContext> c)    { this.safeStateContexts = c != null ? c : new ArrayList<>(); }
    public void setDefaultContext(String c)                       { this.defaultContext = c; }

    @Override
    public String toString() {
        return String.format("AppCatalog{app='%s', signatures=%d, graphScreens=%d, contexts=%d}",
                appId, signatures.size(), graph.size(), safeStateContexts.size());
    }
}
