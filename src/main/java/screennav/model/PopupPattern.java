package screennav.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A known popup: {@code detect} is a selector that reveals it,
 * {@code dismiss} (optional) is the selector of the control that closes it.
 */
public record PopupPattern(
        @JsonProperty("name")    String name,
        @JsonProperty("detect")  String detect,
        @JsonProperty("dismiss") String dismiss
) {

    @JsonCreator
    public PopupPattern {
        if (name == null || name.isBlank()) name = "unnamed";
    }
}
