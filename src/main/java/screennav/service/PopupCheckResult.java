package screennav.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import screennav.model.PatternMatch;

import java.util.List;

/** Outcome of a one-shot popup check. */
public record PopupCheckResult(
        @JsonProperty("found")      List<PatternMatch> found,
        @JsonProperty("checked")    int checked,
        @JsonProperty("anyVisible") boolean anyVisible,
        @JsonProperty("message")    String message
) {

    static PopupCheckResult of(List<PatternMatch> found, int checked) {
        String message = found.isEmpty()
                ? "No configured popups visible"
                : "Found " + found.size() + " popup(s) currently visible";
        return new PopupCheckResult(List.copyOf(found), checked, !found.isEmpty(), message);
    }
}
