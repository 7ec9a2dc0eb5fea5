package screennav.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import screennav.model.NavigationEdge;

import java.util.List;

/** Navigation-graph answer: a whole-graph summary or the edges of one screen. */
public sealed interface GraphView permits GraphView.Summary, GraphView.Edges {

    record Summary(
            @JsonProperty("appId")        String appId,
            @JsonProperty("totalScreens") int totalScreens,
            @JsonProperty("allScreens")   List<String> allScreens,
            @JsonProperty("safeStates")   List<String> safeStates,
            @JsonProperty("contexts")     List<String> contexts
    ) implements GraphView {}

    record Edges(
            @JsonProperty("appId")     String appId,
            @JsonProperty("screenId")  String screenId,
            @JsonProperty("edges")     List<EdgeInfo> edges,
            @JsonProperty("edgeCount") int edgeCount
    ) implements GraphView {}

    record EdgeInfo(
            @JsonProperty("toScreen")     String toScreen,
            @JsonProperty("cost")         double cost,
            @JsonProperty("reliability")  double reliability,
            @JsonProperty("description")  String description,
            @JsonProperty("actionsCount") int actionsCount
    ) {
        static EdgeInfo of(NavigationEdge edge) {
            return new EdgeInfo(edge.getToScreen(), edge.getCost(), edge.getReliability(),
                    edge.getDescription(), edge.getActions().size());
        }
    }
}
