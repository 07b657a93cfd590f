package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Node entity as published by a target cluster.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Node {

    @JsonProperty("name")
    private String name;

    @JsonProperty("conditions")
    private List<NodeCondition> conditions = new ArrayList<>();

    public Node(String name) {
        this.name = name;
    }
}
