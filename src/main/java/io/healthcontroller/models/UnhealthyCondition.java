package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * A node condition that, once held for longer than {@code timeout}, marks the machine unhealthy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnhealthyCondition {

    @JsonProperty("type")
    private String type; // e.g. "Ready"

    @JsonProperty("status")
    private String status; // "True", "False", "Unknown"

    @JsonProperty("timeout")
    private Duration timeout;
}
