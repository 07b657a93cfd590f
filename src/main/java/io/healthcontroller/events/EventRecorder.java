package io.healthcontroller.events;

import io.healthcontroller.enums.EventType;
import io.healthcontroller.metrics.MetricsProvider;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.PolicyEvent;
import io.healthcontroller.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;

import static io.healthcontroller.metrics.MetricsConstants.HEALTH_CHECK_EVENTS_METRIC_NAME;
import static io.healthcontroller.metrics.MetricsConstants.NAMESPACE_TAG;
import static io.healthcontroller.metrics.MetricsConstants.REASON_TAG;

/**
 * Emits user-visible notifications about a policy. Events are persisted next to the
 * policy on a best-effort basis: a failed write is logged and never fails the caller.
 */
@Slf4j
public class EventRecorder {

    private final MetadataStore metadataStore;
    private final MetricsProvider metricsProvider;
    private final String reportingController;
    private final Clock clock;

    public EventRecorder(MetadataStore metadataStore, MetricsProvider metricsProvider,
                         String reportingController, Clock clock) {
        this.metadataStore = metadataStore;
        this.metricsProvider = metricsProvider;
        this.reportingController = reportingController;
        this.clock = clock;
    }

    public void warning(HealthCheckPolicy policy, String reason, String messageFormat, Object... args) {
        record(EventType.WARNING, policy, reason, String.format(messageFormat, args));
    }

    public void normal(HealthCheckPolicy policy, String reason, String messageFormat, Object... args) {
        record(EventType.NORMAL, policy, reason, String.format(messageFormat, args));
    }

    private void record(EventType type, HealthCheckPolicy policy, String reason, String message) {
        if (type == EventType.WARNING) {
            log.warn("Event {} on {} {}: {}", reason, HealthCheckPolicy.KIND, policy.getKey(), message);
        } else {
            log.info("Event {} on {} {}: {}", reason, HealthCheckPolicy.KIND, policy.getKey(), message);
        }

        PolicyEvent event = PolicyEvent.builder()
            .type(type)
            .reason(reason)
            .message(message)
            .namespace(policy.getNamespace())
            .involvedObjectKind(HealthCheckPolicy.KIND)
            .involvedObjectName(policy.getName())
            .reportingController(reportingController)
            .timestamp(clock.instant())
            .build();

        try {
            metadataStore.recordEvent(event);
        } catch (Exception e) {
            log.warn("Failed to persist event {} for {}: {}", reason, policy.getKey(), e.getMessage());
        }

        metricsProvider.counter(HEALTH_CHECK_EVENTS_METRIC_NAME,
            Map.of(NAMESPACE_TAG, policy.getNamespace(), REASON_TAG, reason)).increment();
    }
}
