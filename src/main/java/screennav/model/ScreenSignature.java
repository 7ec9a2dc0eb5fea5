package screennav.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * UI fingerprint of one application screen.
 *
 * <p>Selector lists:
 * <ul>
 *   <li>{@code required}: the fraction present drives the base score</li>
 *   <li>{@code forbidden}: any one present disqualifies the screen</li>
 *   <li>{@code unique}: any one present is a 100% match (unless forbidden)</li>
 *   <li>{@code optional}: adds up to 0.1 on top of the base score</li>
 * </ul>
 *
 * <p>Example JSON:
 * <pre>{@code
 * {
 *   "screenId": "explore_grid",
 *   "description": "Search/Explore landing page",
 *   "priority": 40,
 *   "required": [":id/action_bar_search_edit_text"],
 *   "forbidden": [":id/profile_header_container"],
 *   "unique": [":id/explore_action_bar"],
 *   "safeState": true
 * }
 * }</pre>
 *
 * <p>Instances are immutable; a signature without any required or unique
 * selector could never win a detection and is rejected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ScreenSignature {

    public static final int DEFAULT_PRIORITY = 50;

    private final String       appId;
    private final String       screenId;
    private final String       description;
    private final int          priority;
    private final List<String> required;
    private final List<String> forbidden;
    private final List<String> unique;
    private final List<String> optional;
    private final String       recoveryAction;
    private final boolean      safeState;

    @JsonCreator
    public ScreenSignature(@JsonProperty("appId")          String appId,
                           @JsonProperty("screenId")       String screenId,
                           @JsonProperty("description")    String description,
                           @JsonProperty("priority")       Integer priority,
                           @JsonProperty("required")       List<String> required,
                           @JsonProperty("forbidden")      List<String> forbidden,
                           @JsonProperty("unique")         List<String> unique,
                           @JsonProperty("optional")       List<String> optional,
                           @JsonProperty("recoveryAction") String recoveryAction,
                           @JsonProperty("safeState")      boolean safeState) {
        if (screenId == null || screenId.isBlank()) {
            throw new IllegalArgumentException("Signature has no screenId (app '" + appId + "')");
        }
        this.appId          = appId;
        this.screenId       = screenId;
        this.description    = description != null ? description : "";
        this.priority       = priority != null ? priority : DEFAULT_PRIORITY;
        this.required       = copy(required);
        this.forbidden      = copy(forbidden);
        this.unique         = copy(unique);
        this.optional       = copy(optional);
        this.recoveryAction = recoveryAction;
        this.safeState      = safeState;

        if (this.required.isEmpty() && this.unique.isEmpty()) {
            throw new IllegalArgumentException(
                    "Signature " + getFullId() + " must have required or unique elements");
        }
    }

    public static Builder builder(String appId, String screenId) {
        return new Builder(appId, screenId);
    }

    /**
     * Returns a copy bound to {@code appId}. Catalog files declare the app once
     * at the top level, so signatures read from them arrive without one.
     */
    public ScreenSignature withAppId(String appId) {
        if (Objects.equals(this.appId, appId)) return this;
        return new ScreenSignature(appId, screenId, description, priority, required,
                forbidden, unique, optional, recoveryAction, safeState);
    }

    @JsonProperty("appId")          public String       getAppId()          { return appId; }
    @JsonProperty("screenId")       public String       getScreenId()       { return screenId; }
    @JsonProperty("description")    public String       getDescription()    { return description; }
    @JsonProperty("priority")       public int          getPriority()       { return priority; }
    @JsonProperty("required")       public List<String> getRequired()       { return required; }
    @JsonProperty("forbidden")      public List<String> getForbidden()      { return forbidden; }
    @JsonProperty("unique")         public List<String> getUnique()         { return unique; }
    @JsonProperty("optional")       public List<String> getOptional()       { return optional; }
    @JsonProperty("recoveryAction") public String       getRecoveryAction() { return recoveryAction; }
    @JsonProperty("safeState")      public boolean      isSafeState()       { return safeState; }

    /** {@code appId/screenId}. */
    @JsonIgnore
    public String getFullId() {
        return appId + "/" + screenId;
    }

    private static List<String> copy(List<String> selectors) {
        return selectors == null ? List.of() : List.copyOf(selectors);
    }

    @Override
    public String toString() {
        return String.format("ScreenSignature{%s, priority=%d, required=%d, unique=%d, forbidden=%d}",
                getFullId(), priority, required.size(), unique.size(), forbidden.size());
    }

    // ── Builder ───────────────────────────────────────────────────────────

    /** Convenience builder for signatures declared in code (tests, ad-hoc registration). */
    public static final class Builder {
        private final String appId;
        private final String screenId;
        private String       description = "";
        private int          priority    = DEFAULT_PRIORITY;
        private List<String> required    = List.of();
        private List<String> forbidden   = List.of();
        private List<String> unique      = List.of();
        private List<String> optional    = List.of();
        private String       recoveryAction;
        private boolean      safeState;

        private Builder(String appId, String screenId) {
            this.appId    = appId;
            this.screenId = screenId;
        }

        public Builder description(String d)        { this.description = d; return this; }
        public Builder priority(int p)              { this.priority = p; return this; }
        public Builder required(String... s)        { this.required = List.of(s); return this; }
        public Builder forbidden(String... s)       { this.forbidden = List.of(s); return this; }
        public Builder unique(String... s)          { this.unique = List.of(s); return this; }
        public Builder optional(String... s)        { this.optional = List.of(s); return this; }
        public Builder recoveryAction(String a)     { this.recoveryAction = a; return this; }
        public Builder safeState(boolean safe)      { this.safeState = safe; return this; }

        public ScreenSignature build() {
            return new ScreenSignature(appId, screenId, description, priority, required,
                    forbidden, unique, optional, recoveryAction, safeState);
        }
    }
}
