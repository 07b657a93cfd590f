package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Observed state of a health check policy, written only by the reconciler.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthCheckPolicyStatus {

    @JsonProperty("expected_machines")
    private int expectedMachines;

    @JsonProperty("current_healthy")
    private int currentHealthy;

    @JsonProperty("observed_generation")
    private long observedGeneration;
}
