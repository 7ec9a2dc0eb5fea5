package screennav.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a UI-tree dump as produced by the device driver.
 *
 * <p>Every attribute is optional: a layout container typically has only a
 * class name, a button may carry identifier, text and label at once.
 * {@code visible == null} means the dump did not report visibility and the
 * node is treated as visible.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UiNode {

    /** Full resource identifier, e.g. {@code com.instagram.android:id/search_bar}. */
    @JsonProperty("identifier")
    private String identifier;

    @JsonProperty("text")
    private String text;

    /** Accessibility label (Android content-desc). */
    @JsonProperty("label")
    private String label;

    @JsonProperty("className")
    private String className;

    @JsonProperty("clickable")
    private boolean clickable;

    @JsonProperty("visible")
    private Boolean visible;

    @JsonProperty("bounds")
    private Bounds bounds;

    @JsonProperty("children")
    private List<UiNode> children = new ArrayList<>();

    public UiNode() {}

    public UiNode(String identifier, String text, String label, String className) {
        this.identifier = identifier;
        this.text       = text;
        this.label      = label;
        this.className  = className;
    }

    // ── Fluent helpers for building trees in code ─────────────────────────

    public UiNode withChild(UiNode child) {
        children.add(child);
        return this;
    }

    public UiNode withClickable(boolean clickable) {
        this.clickable = clickable;
        return this;
    }

    public UiNode withVisible(Boolean visible) {
        this.visible = visible;
        return this;
    }

    public UiNode withBounds(Bounds bounds) {
        this.bounds = bounds;
        return this;
    }

    // ── Getters / Setters ─────────────────────────────────────────────────

    public String       getIdentifier() { return identifier; }
    public String       getText()       { return text; }
    public String       getLabel()      { return label; }
    public String       getClassName()  { return className; }
    public boolean      isClickable()   { return clickable; }
    public Boolean      getVisible()    { return visible; }
    public Bounds       getBounds()     { return bounds; }
    public List<UiNode> getChildren()   { return children; }

    public void setIdentifier(String identifier)  { this.identifier = identifier; }
    public void setText(String text)              { this.text = text; }
    public void setLabel(String label)            { this.label = label; }
    public void setClassName(String className)    { this.className = className; }
    public void setClickable(boolean clickable)   { this.clickable = clickable; }
    public void setVisible(Boolean visible)       { this.visible = visible; }
    public void setBounds(Bounds bounds)          { this.bounds = bounds; }
    public void setChildren(List<UiNode> children) {
        this.children = children != null ? children : new ArrayList<>();
    }

    @Override
    public String toString() {
        return String.format("UiNode{id='%s', text='%s', label='%s', class='%s', children=%d}",
                identifier, text, label, className, children.size());
    }
}
