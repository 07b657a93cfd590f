package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Cluster entity. Read-only input to the health controller.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Cluster {

    public static final String KIND = "Cluster";
    public static final String API_VERSION = "cluster.x-k8s.io/v1alpha3";

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("name")
    private String name;

    @JsonProperty("uid")
    private String uid;

    @JsonProperty("paused")
    private boolean paused;

    @JsonProperty("labels")
    private Map<String, String> labels = new HashMap<>();

    public Cluster(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    @JsonIgnore
    public ObjectKey getKey() {
        return ObjectKey.of(namespace, name);
    }
}
