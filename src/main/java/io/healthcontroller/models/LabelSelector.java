package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Label selector as written on a health check policy.
 * Both parts are ANDed; an empty selector selects nothing for health checks.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LabelSelector {

    @JsonProperty("match_labels")
    private Map<String, String> matchLabels = new HashMap<>();

    @JsonProperty("match_expressions")
    private List<LabelSelectorRequirement> matchExpressions = new ArrayList<>();

    public static LabelSelector matchLabels(Map<String, String> labels) {
        return new LabelSelector(new HashMap<>(labels), new ArrayList<>());
    }
}
