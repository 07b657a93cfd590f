package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Where a target cluster publishes its node objects.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterConnection {

    @JsonProperty("endpoints")
    private List<String> endpoints = new ArrayList<>();

    @JsonProperty("key_prefix")
    private String keyPrefix;
}
