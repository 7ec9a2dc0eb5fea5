package screennav.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One primitive UI action inside a {@link NavigationEdge}.
 *
 * <p>The set of variants is closed; executors switch over {@link #type()}.
 * JSON form uses a {@code "type"} discriminator, for example:
 * <pre>{@code
 * { "type": "click_by_label", "label": "Search and explore", "waitAfterSeconds": 1.0 }
 * { "type": "swipe", "direction": "UP", "durationMs": 300 }
 * { "type": "press_back" }
 * }</pre>
 *
 * <p>{@code waitAfterSeconds} is the settle time the executor waits after the
 * action completes; it defaults to zero when omitted.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NavigationAction.PressBack.class,       name = "press_back"),
        @JsonSubTypes.Type(value = NavigationAction.ClickByText.class,     name = "click_by_text"),
        @JsonSubTypes.Type(value = NavigationAction.ClickByLabel.class,    name = "click_by_label"),
        @JsonSubTypes.Type(value = NavigationAction.ClickBySelector.class, name = "click_by_selector"),
        @JsonSubTypes.Type(value = NavigationAction.Swipe.class,           name = "swipe"),
        @JsonSubTypes.Type(value = NavigationAction.Wait.class,            name = "wait"),
        @JsonSubTypes.Type(value = NavigationAction.LaunchApp.class,       name = "launch_app"),
        @JsonSubTypes.Type(value = NavigationAction.PressKey.class,        name = "press_key"),
        @JsonSubTypes.Type(value = NavigationAction.EnterText.class,       name = "enter_text")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface NavigationAction
        permits NavigationAction.PressBack, NavigationAction.ClickByText,
                NavigationAction.ClickByLabel, NavigationAction.ClickBySelector,
                NavigationAction.Swipe, NavigationAction.Wait, NavigationAction.LaunchApp,
                NavigationAction.PressKey, NavigationAction.EnterText {

    ActionType type();

    double waitAfterSeconds();

    /** Short human-readable form used in logs. */
    String describe();

    // ── Factories ─────────────────────────────────────────────────────────

    static NavigationAction pressBack()                      { return new PressBack(0.8); }
    static NavigationAction clickText(String text)           { return new ClickByText(text, 1.0); }
    static NavigationAction clickLabel(String label)         { return new ClickByLabel(label, 1.0); }
    static NavigationAction clickSelector(String selector)   { return new ClickBySelector(selector, 1.0); }
    static NavigationAction swipe(Direction direction)       { return new Swipe(direction, null, null, 300L, 0.5); }
    static NavigationAction waitFor(double seconds)          { return new Wait(seconds); }
    static NavigationAction launchApp(String appId)          { return new LaunchApp(appId, 3.0); }
    static NavigationAction pressKey(String key)             { return new PressKey(key, 0.5); }
    static NavigationAction enterText(String text)           { return new EnterText(text, 0.5); }

    // ── Variants ──────────────────────────────────────────────────────────

    record PressBack(
            @JsonProperty("waitAfterSeconds") double waitAfterSeconds
    ) implements NavigationAction {
        public ActionType type()  { return ActionType.PRESS_BACK; }
        public String describe()  { return "Press back"; }
    }

    record ClickByText(
            @JsonProperty("text")             String text,
            @JsonProperty("waitAfterSeconds") double waitAfterSeconds
    ) implements NavigationAction {
        public ClickByText {
            requireValue(text, "click_by_text", "text");
        }
        public ActionType type()  { return ActionType.CLICK_BY_TEXT; }
        public String describe()  { return "Click text: " + text; }
    }

    record ClickByLabel(
            @JsonProperty("label")            String label,
            @JsonProperty("waitAfterSeconds") double waitAfterSeconds
    ) implements NavigationAction {
        public ClickByLabel {
            requireValue(label, "click_by_label", "label");
        }
        public ActionType type()  { return ActionType.CLICK_BY_LABEL; }
        public String describe()  { return "Click label: " + label; }
    }

    /** Click the first node matching a selector string in the device's own syntax (e.g. XPath). */
    record ClickBySelector(
            @JsonProperty("selector")         String selector,
            @JsonProperty("waitAfterSeconds") double waitAfterSeconds
    ) implements NavigationAction {
        public ClickBySelector {
            requireValue(selector, "click_by_selector", "selector");
        }
        public ActionType type()  { return ActionType.CLICK_BY_SELECTOR; }
        public String describe() {
            return "Click: " + (selector.length() > 50 ? selector.substring(0, 50) : selector);
        }
    }

    /**
     * Either a direction (the driver picks the coordinates) or an explicit
     * from/to pair. Coordinates are interpreted by the driver: values in
     * {@code [0,1]} are screen fractions, larger values are pixels.
     */
    record Swipe(
            @JsonProperty("direction")        Direction direction,
            @JsonProperty("from")             Point from,
            @JsonProperty("to")               Point to,
            @JsonProperty("durationMs")       long durationMs,
            @JsonProperty("waitAfterSeconds") double waitAfterSeconds
    ) implements NavigationAction {
        public Swipe {
            if (direction == null && (from == null || to == null)) {
                throw new IllegalArgumentException("swipe needs a direction or both from and to points");
            }
        }
        public ActionType type()  { return ActionType.SWIPE; }
        public String describe() {
            return direction != null ? "Swipe " + direction.name().toLowerCase() : "Swipe " + from + " -> " + to;
        }
    }

    record Wait(
            @JsonProperty("seconds") double seconds
    ) implements NavigationAction {
        public Wait {
            if (seconds < 0) throw new IllegalArgumentException("wait seconds must be >= 0: " + seconds);
        }
        public ActionType type()        { return ActionType.WAIT; }
        public double waitAfterSeconds() { return 0.0; }
        public String describe()        { return "Wait " + seconds + "s"; }
    }

    record LaunchApp(
            @JsonProperty("appId")            String appId,
            @JsonProperty("waitAfterSeconds") double waitAfterSeconds
    ) implements NavigationAction {
        public LaunchApp {
            requireValue(appId, "launch_app", "appId");
        }
        public ActionType type()  { return ActionType.LAUNCH_APP; }
        public String describe()  { return "Launch " + appId; }
    }

    /** Hardware or IME key, e.g. {@code enter}, {@code home}, {@code search}. */
    record PressKey(
            @JsonProperty("key")              String key,
            @JsonProperty("waitAfterSeconds") double waitAfterSeconds
    ) implements NavigationAction {
        public PressKey {
            requireValue(key, "press_key", "key");
        }
        public ActionType type()  { return ActionType.PRESS_KEY; }
        public String describe()  { return "Press key: " + key; }
    }

    /** Types into the currently focused input. */
    record EnterText(
            @JsonProperty("text")             String text,
            @JsonProperty("waitAfterSeconds") double waitAfterSeconds
    ) implements NavigationAction {
        public EnterText {
            if (text == null) throw new IllegalArgumentException("enter_text action has no text");
        }
        public ActionType type()  { return ActionType.ENTER_TEXT; }
        public String describe()  { return "Enter text (" + text.length() + " chars)"; }
    }

    // ── Value types ───────────────────────────────────────────────────────

    enum Direction { UP, DOWN, LEFT, RIGHT }

    record Point(
            @JsonProperty("x") double x,
            @JsonProperty("y") double y
    ) {
        @Override
        public String toString() {
            return "(" + x + ", " + y + ")";
        }
    }

    private static void requireValue(String value, String action, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(action + " action has no " + field);
        }
    }
}
