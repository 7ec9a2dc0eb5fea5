package screennav.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One scored alternative reported alongside a detection result. */
public record ScreenCandidate(
        @JsonProperty("screenId") String screenId,
        @JsonProperty("score")    double score
) {}
