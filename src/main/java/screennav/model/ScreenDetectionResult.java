package screennav.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Outcome of one screen detection.
 *
 * <p>An unknown screen is a valid result, not an error: {@link #isUnknown()}
 * is true and {@link #getCandidates()} lists the best partial matches.
 * {@link #getError()} is set only when the detection itself could not run
 * (UI dump failed, no signatures registered for the app).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"appId", "screenId", "fullId", "confidence", "confident", "unknown",
        "detectionTimeMs", "matchedElements", "candidates", "description", "safeState",
        "recoveryAction", "error"})
public final class ScreenDetectionResult {

    public static final String UNKNOWN_SCREEN = "unknown";
    public static final double DEFAULT_CONFIDENT_THRESHOLD = 0.8;

    private final String                appId;
    private final String                screenId;
    private final double                confidence;
    private final double                detectionTimeMs;
    private final List<String>          matchedElements;
    private final List<ScreenCandidate> candidates;
    private final String                description;
    private final boolean               safeState;
    private final String                recoveryAction;
    private final String                error;
    private final double                confidentThreshold;

    private ScreenDetectionResult(Builder b) {
        this.appId              = b.appId;
        this.screenId           = b.screenId;
        this.confidence         = b.confidence;
        this.detectionTimeMs    = b.detectionTimeMs;
        this.matchedElements    = List.copyOf(b.matchedElements);
        this.candidates         = List.copyOf(b.candidates);
        this.description        = b.description;
        this.safeState          = b.safeState;
        this.recoveryAction     = b.recoveryAction;
        this.error              = b.error;
        this.confidentThreshold = b.confidentThreshold;
    }

    public static Builder builder(String appId, String screenId) {
        return new Builder(appId, screenId);
    }

    /** An unknown result carrying an error message and nothing else. */
    public static ScreenDetectionResult failed(String appId, String error, double detectionTimeMs) {
        return builder(appId, UNKNOWN_SCREEN)
                .detectionTimeMs(detectionTimeMs)
                .error(error)
                .build();
    }

    @JsonProperty("appId")           public String                getAppId()           { return appId; }
    @JsonProperty("screenId")        public String                getScreenId()        { return screenId; }
    @JsonProperty("confidence")      public double                getConfidence()      { return confidence; }
    @JsonProperty("detectionTimeMs") public double                getDetectionTimeMs() { return detectionTimeMs; }
    @JsonProperty("matchedElements") public List<String>          getMatchedElements() { return matchedElements; }
    @JsonProperty("candidates")      public List<ScreenCandidate> getCandidates()      { return candidates; }
    @JsonProperty("description")     public String                getDescription()     { return description; }
    @JsonProperty("safeState")       public boolean               isSafeState()        { return safeState; }
    @JsonProperty("recoveryAction")  public String                getRecoveryAction()  { return recoveryAction; }
    @JsonProperty("error")           public String                getError()           { return error; }

    /** True when confidence reaches the confident threshold (default 0.8). */
    @JsonProperty("confident")
    public boolean isConfident() {
        return confidence >= confidentThreshold;
    }

    @JsonProperty("unknown")
    public boolean isUnknown() {
        return UNKNOWN_SCREEN.equals(screenId);
    }

    @JsonProperty("fullId")
    public String getFullId() {
        return appId + "/" + screenId;
    }

    /** True when the detection could not run at all. */
    public boolean hasError() {
        return error != null;
    }

    @Override
    public String toString() {
        return error != null
                ? String.format("ScreenDetectionResult{%s, ERROR: %s}", getFullId(), error)
                : String.format("ScreenDetectionResult{%s, confidence=%.2f, %.1fms}",
                                getFullId(), confidence, detectionTimeMs);
    }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {
        private final String          appId;
        private final String          screenId;
        private double                confidence;
        private double                detectionTimeMs;
        private List<String>          matchedElements    = List.of();
        private List<ScreenCandidate> candidates         = List.of();
        private String                description        = "";
        private boolean               safeState;
        private String                recoveryAction;
        private String                error;
        private double                confidentThreshold = DEFAULT_CONFIDENT_THRESHOLD;

        private Builder(String appId, String screenId) {
            this.appId    = appId;
            this.screenId = screenId;
        }

        public Builder confidence(double c)                     { this.confidence = c; return this; }
        public Builder detectionTimeMs(double ms)               { this.detectionTimeMs = ms; return this; }
        public Builder matchedElements(List<String> m)          { this.matchedElements = m; return this; }
        public Builder candidates(List<ScreenCandidate> c)      { this.candidates = c; return this; }
        public Builder description(String d)                    { this.description = d != null ? d : ""; return this; }
        public Builder safeState(boolean s)                     { this.safeState = s; return this; }
        public Builder recoveryAction(String a)                 { this.recoveryAction = a; return this; }
        public Builder error(String e)                          { this.error = e; return this; }
        public Builder confidentThreshold(double t)             { this.confidentThreshold = t; return this; }

        public ScreenDetectionResult build() {
            return new ScreenDetectionResult(this);
        }
    }
}
