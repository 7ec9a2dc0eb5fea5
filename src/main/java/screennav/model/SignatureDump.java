package screennav.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Element lists extracted from a fresh dump, grouped by kind, for authoring
 * new signatures when detection reports an unknown screen.
 */
public record SignatureDump(
        @JsonProperty("timestamp")     Instant timestamp,
        @JsonProperty("identifiers")   List<String> identifiers,
        @JsonProperty("labels")        List<String> labels,
        @JsonProperty("texts")         List<String> texts,
        @JsonProperty("classes")       List<String> classes,
        @JsonProperty("clickables")    List<String> clickables,
        @JsonProperty("totalElements") int totalElements,
        @JsonProperty("hint")          String hint
) {

    public static final String HINT =
            "Use identifiers for stable signatures (clone-safe with the :id/xxx format)";
}
