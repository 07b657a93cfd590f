package io.healthcontroller.api.handlers;

import io.healthcontroller.api.models.responses.ErrorResponse;
import io.healthcontroller.api.models.responses.ReconcileAcceptedResponse;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.models.PolicyEvent;
import io.healthcontroller.reconcile.ReconcileQueue;
import io.healthcontroller.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * REST API handler for inspecting health check policies.
 *
 * Supported operations:
 * - GET /{namespace}/health-checks - Policies in a namespace with their status
 * - GET /{namespace}/health-checks/{name} - One policy
 * - GET /{namespace}/health-checks/{name}/events - Events recorded for a policy
 * - POST /{namespace}/health-checks/{name}/_reconcile - Queue a reconciliation pass
 */
@Slf4j
@RestController
@RequestMapping("/{namespace}/health-checks")
public class HealthCheckHandler {

    private final MetadataStore metadataStore;
    private final ReconcileQueue reconcileQueue;

    public HealthCheckHandler(MetadataStore metadataStore, ReconcileQueue reconcileQueue) {
        this.metadataStore = metadataStore;
        this.reconcileQueue = reconcileQueue;
    }

    @GetMapping
    public ResponseEntity<Object> listHealthChecks(@PathVariable String namespace) {
        try {
            log.info("Listing health check policies in namespace '{}'", namespace);
            List<HealthCheckPolicy> policies = metadataStore.listHealthChecks(namespace);
            return ResponseEntity.ok(policies);
        } catch (Exception e) {
            log.error("Error listing health check policies in namespace '{}': {}", namespace, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{name}")
    public ResponseEntity<Object> getHealthCheck(@PathVariable String namespace, @PathVariable String name) {
        try {
            Optional<HealthCheckPolicy> policy = metadataStore.getHealthCheck(ObjectKey.of(namespace, name));
            if (policy.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.notFound("HealthCheckPolicy [" + namespace + "/" + name + "]"));
            }
            return ResponseEntity.ok(policy.get());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Error getting health check policy '{}/{}': {}", namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/{name}/events")
    public ResponseEntity<Object> getEvents(@PathVariable String namespace, @PathVariable String name) {
        try {
            List<PolicyEvent> events = metadataStore.listEvents(ObjectKey.of(namespace, name));
            return ResponseEntity.ok(events);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Error listing events of health check policy '{}/{}': {}", namespace, name, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @PostMapping("/{name}/_reconcile")
    public ResponseEntity<Object> reconcile(@PathVariable String namespace, @PathVariable String name) {
        try {
            ObjectKey key = ObjectKey.of(namespace, name);
            log.info("Queueing reconciliation of health check policy {} on request", key);
            reconcileQueue.add(key);
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new ReconcileAcceptedResponse(true, key.toString(), reconcileQueue.length()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(ErrorResponse.badRequest(e.getMessage()));
        }
    }
}
