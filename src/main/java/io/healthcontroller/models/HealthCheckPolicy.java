package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HealthCheckPolicy entity: selects machines of one cluster and defines when they are unhealthy.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthCheckPolicy {

    public static final String KIND = "HealthCheckPolicy";

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("name")
    private String name;

    @JsonProperty("uid")
    private String uid;

    @JsonProperty("generation")
    private long generation;

    // left null until the reconciler defaults it
    @JsonProperty("labels")
    private Map<String, String> labels;

    @JsonProperty("owner_references")
    private List<OwnerReference> ownerReferences = new ArrayList<>();

    @JsonProperty("spec")
    private HealthCheckPolicySpec spec = new HealthCheckPolicySpec();

    @JsonProperty("status")
    private HealthCheckPolicyStatus status = new HealthCheckPolicyStatus();

    // etcd mod revision the object was read at, used for compare-and-swap writes
    @JsonIgnore
    private long revision;

    public HealthCheckPolicy(String namespace, String name, String clusterName) {
        this.namespace = namespace;
        this.name = name;
        this.spec.setClusterName(clusterName);
    }

    // stored objects may carry explicit nulls; keep these fields non-null for readers
    public void setOwnerReferences(List<OwnerReference> ownerReferences) {
        this.ownerReferences = ownerReferences != null ? ownerReferences : new ArrayList<>();
    }

    public void setSpec(HealthCheckPolicySpec spec) {
        this.spec = spec != null ? spec : new HealthCheckPolicySpec();
    }

    public void setStatus(HealthCheckPolicyStatus status) {
        this.status = status != null ? status : new HealthCheckPolicyStatus();
    }

    @JsonIgnore
    public ObjectKey getKey() {
        return ObjectKey.of(namespace, name);
    }
}
