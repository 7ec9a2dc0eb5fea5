package screennav.model;

import java.util.List;

/**
 * Ordered steps from a start screen to a target screen.
 * Empty exactly when start and target are the same screen.
 */
public final class NavigationPath {

    private static final NavigationPath EMPTY = new NavigationPath(List.of());

    private final List<NavigationStep> steps;
    private final double totalCost;
    private final double estimatedReliability;

    public NavigationPath(List<NavigationStep> steps) {
        this.steps = List.copyOf(steps);
        double cost = 0.0;
        double reliability = 1.0;
        for (NavigationStep step : this.steps) {
            cost        += step.edge().getCost();
            reliability *= step.edge().getReliability();
        }
        this.totalCost            = cost;
        this.estimatedReliability = reliability;
    }

    public static NavigationPath empty() {
        return EMPTY;
    }

    public List<NavigationStep> getSteps()                { return steps; }
    public double               getTotalCost()            { return totalCost; }
    public double               getEstimatedReliability() { return estimatedReliability; }

    public int size()          { return steps.size(); }
    public boolean isEmpty()   { return steps.isEmpty(); }

    /** Last screen of the path, or {@code null} for an empty path. */
    public String getDestination() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1).toScreen();
    }

    public List<String> summary() {
        return steps.stream().map(NavigationStep::summary).toList();
    }

    @Override
    public String toString() {
        return String.format("NavigationPath{%s, cost=%.1f, reliability=%.1f%%}",
                summary(), totalCost, estimatedReliability * 100);
    }
}
