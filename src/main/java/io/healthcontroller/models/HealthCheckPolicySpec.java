package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Desired behaviour of a health check policy.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthCheckPolicySpec {

    @JsonProperty("cluster_name")
    private String clusterName;

    @JsonProperty("selector")
    private LabelSelector selector = new LabelSelector();

    @JsonProperty("unhealthy_conditions")
    private List<UnhealthyCondition> unhealthyConditions = new ArrayList<>();

    // null means the controller default applies
    @JsonProperty("node_startup_timeout")
    private Duration nodeStartupTimeout;

    @JsonProperty("paused")
    private boolean paused;
}
