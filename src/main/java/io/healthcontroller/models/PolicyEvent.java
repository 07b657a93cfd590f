package io.healthcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.healthcontroller.enums.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * User-visible notification attached to a health check policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyEvent {

    @JsonProperty("type")
    private EventType type;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("message")
    private String message;

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("involved_object_kind")
    private String involvedObjectKind;

    @JsonProperty("involved_object_name")
    private String involvedObjectName;

    @JsonProperty("reporting_controller")
    private String reportingController;

    @JsonProperty("timestamp")
    private Instant timestamp;
}
