package screennav.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A popup pattern found on the current screen. */
public record PatternMatch(
        @JsonProperty("name")    String name,
        @JsonProperty("detect")  String detect,
        @JsonProperty("dismiss") String dismiss
) {}
