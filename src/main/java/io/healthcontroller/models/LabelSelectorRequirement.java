package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A single set-based selector expression, e.g. {@code zone In (a, b)}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LabelSelectorRequirement {

    @JsonProperty("key")
    private String key;

    @JsonProperty("operator")
    private String operator; // "In", "NotIn", "Exists", "DoesNotExist"

    @JsonProperty("values")
    private List<String> values = new ArrayList<>();
}
