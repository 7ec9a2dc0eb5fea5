package screennav.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A named set of screens that are acceptable places to pause or recover to,
 * with one preferred screen that recovery tries first.
 */
public record SafeStateContext(
        @JsonProperty("name")      String name,
        @JsonProperty("preferred") String preferred,
        @JsonProperty("targets")   List<String> targets
) {

    @JsonCreator
    public SafeStateContext {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Safe-state context has no name");
        }
        if (preferred == null || preferred.isBlank()) {
            throw new IllegalArgumentException("Safe-state context '" + name + "' has no preferred screen");
        }
        targets = targets != null ? List.copyOf(targets) : List.of();
    }

    /** Preferred screen first, then the remaining targets in declaration order, without duplicates. */
    public List<String> orderedTargets() {
        List<String> ordered = new ArrayList<>();
        ordered.add(preferred);
        for (String t : targets) {
            if (!ordered.contains(t)) ordered.add(t);
        }
        return List.copyOf(ordered);
    }
}
