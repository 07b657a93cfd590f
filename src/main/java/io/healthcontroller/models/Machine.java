package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Machine entity: a compute instance of a cluster that becomes a node once provisioned.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Machine {

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("name")
    private String name;

    @JsonProperty("uid")
    private String uid;

    @JsonProperty("cluster_name")
    private String clusterName;

    @JsonProperty("labels")
    private Map<String, String> labels = new HashMap<>();

    @JsonProperty("creation_timestamp")
    private Instant creationTimestamp;

    // name of the node this machine became, null until provisioned
    @JsonProperty("node_ref")
    private String nodeRef;

    public Machine(String namespace, String name, String clusterName) {
        this.namespace = namespace;
        this.name = name;
        this.clusterName = clusterName;
    }

    @JsonIgnore
    public ObjectKey getKey() {
        return ObjectKey.of(namespace, name);
    }
}
