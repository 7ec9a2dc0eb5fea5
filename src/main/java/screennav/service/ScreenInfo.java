package screennav.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import screennav.model.ScreenSignature;

import java.util.List;
import java.util.Set;

/** Signature catalog answer: the screens of an app, or one screen's signature. */
public sealed interface ScreenInfo permits ScreenInfo.Listing, ScreenInfo.Detail {

    record Listing(
            @JsonProperty("appId")         String appId,
            @JsonProperty("screens")       List<String> screens,
            @JsonProperty("safeStates")    List<String> safeStates,
            @JsonProperty("totalCount")    int totalCount,
            @JsonProperty("appsAvailable") Set<String> appsAvailable
    ) implements ScreenInfo {}

    record Detail(
            @JsonProperty("signature") ScreenSignature signature
    ) implements ScreenInfo {}
}
