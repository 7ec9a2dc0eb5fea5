package screennav.detect;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Point-in-time copy of a device's detection counters. */
public record DetectionStats(
        @JsonProperty("detectionCount") long detectionCount,
        @JsonProperty("averageTimeMs")  double averageTimeMs,
        @JsonProperty("unknownCount")   long unknownCount,
        @JsonProperty("unknownRate")    double unknownRate
) {}
