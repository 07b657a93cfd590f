package io.healthcontroller.reconcile;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.HealthCheckPolicyStatus;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.models.OwnerReference;
import io.healthcontroller.store.ConflictException;
import io.healthcontroller.store.MetadataStore;
import io.healthcontroller.store.ResourceNotFoundException;
import io.healthcontroller.util.OwnerReferences;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshots a policy when opened and writes back the fields this controller owns
 * (labels, owner references, status) when closed. Use with try-with-resources so the
 * write happens on every exit path; a failed write thrown from {@link #close()} is then
 * attached to the primary exception as suppressed.
 *
 * Writes are compare-and-swap on the read revision. On conflict the latest version is
 * re-read and only the owned fields changed during the pass are re-applied to it.
 */
@Slf4j
public class PolicyPatchHelper implements AutoCloseable {

    static final int MAX_PATCH_ATTEMPTS = 5;

    private final MetadataStore metadataStore;
    private final HealthCheckPolicy original;
    private final HealthCheckPolicy working;
    private boolean patched;

    public PolicyPatchHelper(HealthCheckPolicy policy, MetadataStore metadataStore, ObjectMapper objectMapper) {
        this.metadataStore = metadataStore;
        this.working = policy;
        this.original = objectMapper.convertValue(policy, HealthCheckPolicy.class);
        this.original.setRevision(policy.getRevision());
    }

    @Override
    public void close() throws Exception {
        if (patched) {
            return;
        }
        patched = true;
        patch();
    }

    void patch() throws Exception {
        ObjectKey key = working.getKey();
        if (!hasOwnedChanges()) {
            log.debug("No changes to write back for {}", key);
            return;
        }

        HealthCheckPolicy toWrite = working;
        for (int attempt = 1; attempt <= MAX_PATCH_ATTEMPTS; attempt++) {
            try {
                long revision = metadataStore.updateHealthCheck(toWrite);
                working.setRevision(revision);
                log.debug("Patched {} at revision {} (attempt {})", key, revision, attempt);
                return;
            } catch (ConflictException e) {
                log.debug("Conflict patching {} on attempt {}, re-reading latest version", key, attempt);
                HealthCheckPolicy latest = metadataStore.getHealthCheck(key)
                    .orElseThrow(() -> new ResourceNotFoundException(HealthCheckPolicy.KIND, key));
                toWrite = applyOwnedChanges(latest);
            }
        }
        throw new ConflictException("Failed to patch " + HealthCheckPolicy.KIND + " " + key
            + " after " + MAX_PATCH_ATTEMPTS + " attempts");
    }

    boolean hasOwnedChanges() {
        return !Objects.equals(original.getLabels(), working.getLabels())
            || !Objects.equals(original.getOwnerReferences(), working.getOwnerReferences())
            || !Objects.equals(original.getStatus(), working.getStatus());
    }

    /**
     * Re-apply this pass's owned-field changes onto {@code latest}.
     */
    HealthCheckPolicy applyOwnedChanges(HealthCheckPolicy latest) {
        Map<String, String> labelsBefore = original.getLabels() != null ? original.getLabels() : Map.of();
        Map<String, String> labelsAfter = working.getLabels() != null ? working.getLabels() : Map.of();
        if (!labelsBefore.equals(labelsAfter)) {
            Map<String, String> labels = latest.getLabels() != null ? new HashMap<>(latest.getLabels()) : new HashMap<>();
            for (Map.Entry<String, String> entry : labelsAfter.entrySet()) {
                if (!Objects.equals(labelsBefore.get(entry.getKey()), entry.getValue())) {
                    labels.put(entry.getKey(), entry.getValue());
                }
            }
            for (String removed : labelsBefore.keySet()) {
                if (!labelsAfter.containsKey(removed)) {
                    labels.remove(removed);
                }
            }
            latest.setLabels(labels);
        }

        List<OwnerReference> before = original.getOwnerReferences() != null ? original.getOwnerReferences() : List.of();
        List<OwnerReference> refs = latest.getOwnerReferences();
        for (OwnerReference ref : working.getOwnerReferences()) {
            if (!before.contains(ref)) {
                refs = OwnerReferences.ensureOwnerRef(refs, ref);
            }
        }
        latest.setOwnerReferences(refs);

        HealthCheckPolicyStatus status = working.getStatus();
        latest.setStatus(new HealthCheckPolicyStatus(
            status.getExpectedMachines(), status.getCurrentHealthy(), status.getObservedGeneration()));
        return latest;
    }
}
