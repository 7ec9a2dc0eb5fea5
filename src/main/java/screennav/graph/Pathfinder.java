package screennav.graph;

import screennav.model.NavigationEdge;
import screennav.model.NavigationPath;
import screennav.model.NavigationStep;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Breadth-first search over a {@link NavigationGraph}.
 *
 * <p>Returns a path with the fewest edges. Among equally short paths the
 * first one discovered wins, i.e. edges are explored in declaration order.
 * Edge cost and reliability do not influence the choice.
 */
public final class Pathfinder {

    private Pathfinder() {}

    /**
     * @return an empty path when {@code from} equals {@code to},
     *         {@code Optional.empty()} when {@code to} is unreachable
     */
    public static Optional<NavigationPath> findPath(NavigationGraph graph, String from, String to) {
        return findPathToAny(graph, from, List.of(to));
    }

    /** Shortest path to whichever of {@code targets} is reached first. */
    public static Optional<NavigationPath> findPathToAny(NavigationGraph graph, String from,
                                                         Collection<String> targets) {
        if (targets.isEmpty()) return Optional.empty();
        Set<String> goal = new HashSet<>(targets);
        if (goal.contains(from)) {
            return Optional.of(NavigationPath.empty());
        }

        Set<String> visited = new HashSet<>();
        visited.add(from);
        Queue<Node> queue = new ArrayDeque<>();
        queue.add(new Node(from, List.of()));

        while (!queue.isEmpty()) {
            Node current = queue.poll();
            for (NavigationEdge edge : graph.edgesFrom(current.screen())) {
                String next = edge.getToScreen();
                if (!visited.add(next)) continue;

                List<NavigationStep> steps = new ArrayList<>(current.steps());
                steps.add(new NavigationStep(current.screen(), next, edge));
                if (goal.contains(next)) {
                    return Optional.of(new NavigationPath(steps));
                }
                queue.add(new Node(next, steps));
            }
        }
        return Optional.empty();
    }

    private record Node(String screen, List<NavigationStep> steps) {}
}
