package screennav.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A directed transition to {@link #getToScreen()} performed by running
 * {@link #getActions()} in order.
 *
 * <p>{@code cost} and {@code reliability} are informational: pathfinding
 * minimises the number of edges, not their cost.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NavigationEdge {

    public static final double DEFAULT_COST        = 1.0;
    public static final double DEFAULT_RELIABILITY = 0.95;

    private final String                 toScreen;
    private final List<NavigationAction> actions;
    private final double                 cost;
    private final double                 reliability;
    private final String                 description;

    @JsonCreator
    public NavigationEdge(@JsonProperty("toScreen")    String toScreen,
                          @JsonProperty("actions")     List<NavigationAction> actions,
                          @JsonProperty("cost")        Double cost,
                          @JsonProperty("reliability") Double reliability,
                          @JsonProperty("description") String description) {
        if (toScreen == null || toScreen.isBlank()) {
            throw new IllegalArgumentException("Edge has no toScreen");
        }
        double r = reliability != null ? reliability : DEFAULT_RELIABILITY;
        if (r < 0.0 || r > 1.0) {
            throw new IllegalArgumentException("Edge reliability must be within [0,1]: " + r);
        }
        this.toScreen    = toScreen;
        this.actions     = actions != null ? List.copyOf(actions) : List.of();
        this.cost        = cost != null ? cost : DEFAULT_COST;
        this.reliability = r;
        this.description = description != null ? description : "";
    }

    public NavigationEdge(String toScreen, List<NavigationAction> actions, String description) {
        this(toScreen, actions, DEFAULT_COST, DEFAULT_RELIABILITY, description);
    }

    @JsonProperty("toScreen")    public String                 getToScreen()    { return toScreen; }
    @JsonProperty("actions")     public List<NavigationAction> getActions()     { return actions; }
    @JsonProperty("cost")        public double                 getCost()        { return cost; }
    @JsonProperty("reliability") public double                 getReliability() { return reliability; }
    @JsonProperty("description") public String                 getDescription() { return description; }

    @Override
    public String toString() {
        return String.format("NavigationEdge{-> %s, %d action(s), cost=%.1f, reliability=%.2f}",
                toScreen, actions.size(), cost, reliability);
    }
}
