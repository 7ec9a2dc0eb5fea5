package screennav.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-screen rectangle of a UI node in device pixels, as reported by the
 * hierarchy dump ({@code [left,top][right,bottom]}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Bounds {

    @JsonProperty("left")
    private int left;

    @JsonProperty("top")
    private int top;

    @JsonProperty("right")
    private int right;

    @JsonProperty("bottom")
    private int bottom;

    public Bounds() {}

    public Bounds(int left, int top, int right, int bottom) {
        this.left   = left;
        this.top    = top;
        this.right  = right;
        this.bottom = bottom;
    }

    public int getLeft()   { return left; }
    public int getTop()    { return top; }
    public int getRight()  { return right; }
    public int getBottom() { return bottom; }

    public void setLeft(int left)     { this.left = left; }
    public void setTop(int top)       { this.top = top; }
    public void setRight(int right)   { this.right = right; }
    public void setBottom(int bottom) { this.bottom = bottom; }

    @JsonIgnore
    public int getWidth()  { return right - left; }

    @JsonIgnore
    public int getHeight() { return bottom - top; }

    /** False for collapsed nodes that the user cannot see. */
    @JsonIgnore
    public boolean hasArea() {
        return getWidth() > 0 && getHeight() > 0;
    }

    @Override
    public String toString() {
        return String.format("[%d,%d][%d,%d]", left, top, right, bottom);
    }
}
