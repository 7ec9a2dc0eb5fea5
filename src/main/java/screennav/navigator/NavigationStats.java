package screennav.navigator;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Point-in-time copy of a device's navigation counters. */
public record NavigationStats(
        @JsonProperty("totalNavigations")             long totalNavigations,
        @JsonProperty("successfulNavigations")        long successfulNavigations,
        @JsonProperty("successRate")                  double successRate,
        @JsonProperty("totalStepsExecuted")           long totalStepsExecuted,
        @JsonProperty("averageNavigationTimeSeconds") double averageNavigationTimeSeconds,
        @JsonProperty("graphSize")                    int graphSize
) {}
