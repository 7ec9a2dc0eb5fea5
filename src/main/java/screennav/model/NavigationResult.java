package screennav.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Immutable outcome of a navigation or safe-state recovery. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "success", "startScreen", "targetScreen", "finalScreen",
        "stepsCompleted", "totalTimeSeconds", "errorMessage", "recoveryAttempts", "pathSummary"})
public final class NavigationResult {

    private final NavigationStatus status;
    private final String           startScreen;
    private final String           targetScreen;
    private final String           finalScreen;
    private final int              stepsCompleted;
    private final List<String>     pathSummary;
    private final double           totalTimeSeconds;
    private final int              recoveryAttempts;
    private final String           errorMessage;

    public NavigationResult(NavigationStatus status, String startScreen, String targetScreen,
                            String finalScreen, int stepsCompleted, List<String> pathSummary,
                            double totalTimeSeconds, int recoveryAttempts, String errorMessage) {
        this.status           = status;
        this.startScreen      = startScreen;
        this.targetScreen     = targetScreen;
        this.finalScreen      = finalScreen;
        this.stepsCompleted   = stepsCompleted;
        this.pathSummary      = pathSummary != null ? List.copyOf(pathSummary) : List.of();
        this.totalTimeSeconds = totalTimeSeconds;
        this.recoveryAttempts = recoveryAttempts;
        this.errorMessage     = errorMessage;
    }

    @JsonProperty("status")           public NavigationStatus getStatus()           { return status; }
    @JsonProperty("startScreen")      public String           getStartScreen()      { return startScreen; }
    @JsonProperty("targetScreen")     public String           getTargetScreen()     { return targetScreen; }
    @JsonProperty("finalScreen")      public String           getFinalScreen()      { return finalScreen; }
    @JsonProperty("stepsCompleted")   public int              getStepsCompleted()   { return stepsCompleted; }
    @JsonProperty("pathSummary")      public List<String>     getPathSummary()      { return pathSummary; }
    @JsonProperty("totalTimeSeconds") public double           getTotalTimeSeconds() { return totalTimeSeconds; }
    @JsonProperty("recoveryAttempts") public int              getRecoveryAttempts() { return recoveryAttempts; }
    @JsonProperty("errorMessage")     public String           getErrorMessage()     { return errorMessage; }

    @JsonProperty("success")
    public boolean isSuccess() {
        return status == NavigationStatus.SUCCESS || status == NavigationStatus.ALREADY_THERE;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? String.format("NavigationResult{%s, %s -> %s, %d step(s), %.2fs}",
                                status, startScreen, finalScreen, stepsCompleted, totalTimeSeconds)
                : String.format("NavigationResult{%s, %s -> %s (wanted %s): %s}",
                                status, startScreen, finalScreen, targetScreen, errorMessage);
    }
}
