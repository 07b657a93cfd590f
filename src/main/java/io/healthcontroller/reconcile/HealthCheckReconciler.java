package io.healthcontroller.reconcile;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.healthcontroller.events.EventRecorder;
import io.healthcontroller.health.HealthCheckResult;
import io.healthcontroller.health.HealthCheckTarget;
import io.healthcontroller.health.HealthEvaluator;
import io.healthcontroller.health.TargetResolver;
import io.healthcontroller.metrics.MetricsProvider;
import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.ClusterConnection;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.models.OwnerReference;
import io.healthcontroller.remote.RemoteClusterClientFactory;
import io.healthcontroller.store.MetadataStore;
import io.healthcontroller.util.OwnerReferences;
import io.healthcontroller.watch.ClusterWatch;
import io.healthcontroller.watch.ClusterWatchRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.healthcontroller.config.Constants.CLUSTER_NAME_LABEL;
import static io.healthcontroller.config.Constants.REASON_MACHINE_UNHEALTHY;
import static io.healthcontroller.config.Constants.REASON_RECONCILE_ERROR;
import static io.healthcontroller.metrics.MetricsConstants.HEALTH_CHECK_CURRENT_HEALTHY_METRIC_NAME;
import static io.healthcontroller.metrics.MetricsConstants.HEALTH_CHECK_EXPECTED_MACHINES_METRIC_NAME;
import static io.healthcontroller.metrics.MetricsConstants.NAMESPACE_TAG;
import static io.healthcontroller.metrics.MetricsConstants.POLICY_TAG;

/**
 * Reconciles one HealthCheckPolicy: resolves the machines it covers on its target cluster,
 * classifies them, writes the counts back to the policy status and schedules the next
 * check for machines that are not yet decidable.
 *
 * Every pass re-reads its inputs, so running it again for the same key is always safe.
 */
@Slf4j
public class HealthCheckReconciler implements Reconciler {

    private final MetadataStore metadataStore;
    private final RemoteClusterClientFactory clientFactory;
    private final ClusterWatchRegistry watchRegistry;
    private final TargetResolver targetResolver;
    private final HealthEvaluator healthEvaluator;
    private final EventRecorder eventRecorder;
    private final MetricsProvider metricsProvider;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HealthCheckReconciler(MetadataStore metadataStore,
                                 RemoteClusterClientFactory clientFactory,
                                 ClusterWatchRegistry watchRegistry,
                                 TargetResolver targetResolver,
                                 HealthEvaluator healthEvaluator,
                                 EventRecorder eventRecorder,
                                 MetricsProvider metricsProvider,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.metadataStore = metadataStore;
        this.clientFactory = clientFactory;
        this.watchRegistry = watchRegistry;
        this.targetResolver = targetResolver;
        this.healthEvaluator = healthEvaluator;
        this.eventRecorder = eventRecorder;
        this.metricsProvider = metricsProvider;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ReconcileResult reconcile(ObjectKey key) throws ReconcileException {
        HealthCheckPolicy policy;
        try {
            Optional<HealthCheckPolicy> found = metadataStore.getHealthCheck(key);
            if (found.isEmpty()) {
                log.debug("HealthCheckPolicy {} no longer exists, nothing to do", key);
                clearStatusMetrics(key);
                return ReconcileResult.done();
            }
            policy = found.get();
        } catch (Exception e) {
            log.error("Failed to fetch HealthCheckPolicy {}", key, e);
            throw new ReconcileException(key, "failed to get HealthCheckPolicy " + key, e);
        }

        Cluster cluster = fetchCluster(policy);

        if (cluster.isPaused() || policy.getSpec().isPaused()) {
            log.debug("Reconciliation is paused for HealthCheckPolicy {}", key);
            return ReconcileResult.done();
        }

        try (PolicyPatchHelper patchHelper = new PolicyPatchHelper(policy, metadataStore, objectMapper)) {
            try {
                return reconcileHealth(cluster, policy);
            } catch (RuntimeException e) {
                throw new ReconcileException(key, "failed to reconcile HealthCheckPolicy " + key, e);
            }
        } catch (ReconcileException e) {
            log.error("Failed to reconcile HealthCheckPolicy {}", key, e);
            eventRecorder.warning(policy, REASON_RECONCILE_ERROR, "%s", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Failed to patch HealthCheckPolicy {}", key, e);
            throw new ReconcileException(key, "failed to patch HealthCheckPolicy " + key, e);
        }
    }

    private Cluster fetchCluster(HealthCheckPolicy policy) throws ReconcileException {
        String clusterName = policy.getSpec().getClusterName();
        String message = String.format("failed to get Cluster %s for HealthCheckPolicy %s in namespace %s",
            clusterName, policy.getName(), policy.getNamespace());
        try {
            Optional<Cluster> cluster = metadataStore.getCluster(ObjectKey.of(policy.getNamespace(), clusterName));
            if (cluster.isEmpty()) {
                log.error("Cluster {} for HealthCheckPolicy {} not found", clusterName, policy.getKey());
                throw new ReconcileException(policy.getKey(), message + ": not found", null);
            }
            return cluster.get();
        } catch (ReconcileException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch Cluster for HealthCheckPolicy {}", policy.getKey(), e);
            throw new ReconcileException(policy.getKey(), message, e);
        }
    }

    ReconcileResult reconcileHealth(Cluster cluster, HealthCheckPolicy policy) throws ReconcileException {
        ObjectKey key = policy.getKey();

        if (policy.getLabels() == null) {
            policy.setLabels(new HashMap<>());
        }
        policy.getLabels().put(CLUSTER_NAME_LABEL, cluster.getName());

        policy.setOwnerReferences(OwnerReferences.ensureOwnerRef(policy.getOwnerReferences(),
            new OwnerReference(Cluster.API_VERSION, Cluster.KIND, cluster.getName(), cluster.getUid())));

        ClusterConnection connection;
        try {
            connection = clientFactory.buildConfig(cluster);
        } catch (Exception e) {
            log.error("Error building target cluster client for {}", cluster.getKey(), e);
            throw new ReconcileException(key, "error building target cluster client for " + cluster.getKey(), e);
        }

        ClusterWatch watch;
        try {
            watch = watchRegistry.ensureWatch(cluster.getKey(), connection);
        } catch (Exception e) {
            log.error("Error watching nodes on target cluster {}", cluster.getKey(), e);
            throw new ReconcileException(key, "error watching nodes on target cluster " + cluster.getKey(), e);
        }

        List<HealthCheckTarget> targets;
        try {
            targets = targetResolver.resolveTargets(watch.getInformer(), cluster, policy);
        } catch (Exception e) {
            log.error("Failed to fetch targets from HealthCheckPolicy {}", key, e);
            throw new ReconcileException(key, "failed to fetch targets from HealthCheckPolicy " + key, e);
        }

        HealthCheckResult result = healthEvaluator.evaluate(targets, policy, clock.instant());

        policy.getStatus().setExpectedMachines(targets.size());
        policy.getStatus().setCurrentHealthy(result.getHealthyCount());
        policy.getStatus().setObservedGeneration(policy.getGeneration());
        recordStatusMetrics(policy);

        log.debug("HealthCheckPolicy {}: {} targets, {} healthy", key, targets.size(), result.getHealthyCount());

        for (HealthCheckTarget target : result.getNeedsRemediation()) {
            log.info("Target meets unhealthy criteria, triggers remediation, target={}", target);
            eventRecorder.warning(policy, REASON_MACHINE_UNHEALTHY,
                "Machine %s has been marked as unhealthy", target.getMachine().getName());
        }

        Optional<Duration> nextCheck = result.minNextCheck();
        if (nextCheck.isPresent()) {
            log.debug("Some targets might go unhealthy, ensuring a requeue in {}s",
                nextCheck.get().truncatedTo(ChronoUnit.SECONDS).getSeconds());
            return ReconcileResult.requeueAfter(nextCheck.get());
        }

        log.debug("No more targets meet unhealthy criteria for {}", key);
        return ReconcileResult.done();
    }

    private void clearStatusMetrics(ObjectKey key) {
        Map<String, String> tags = Map.of(NAMESPACE_TAG, key.getNamespace(), POLICY_TAG, key.getName());
        metricsProvider.removeGauge(HEALTH_CHECK_EXPECTED_MACHINES_METRIC_NAME, tags);
        metricsProvider.removeGauge(HEALTH_CHECK_CURRENT_HEALTHY_METRIC_NAME, tags);
    }

    private void recordStatusMetrics(HealthCheckPolicy policy) {
        Map<String, String> tags = Map.of(NAMESPACE_TAG, policy.getNamespace(), POLICY_TAG, policy.getName());
        metricsProvider.gauge(HEALTH_CHECK_EXPECTED_MACHINES_METRIC_NAME, tags).set(policy.getStatus().getExpectedMachines());
        metricsProvider.gauge(HEALTH_CHECK_CURRENT_HEALTHY_METRIC_NAME, tags).set(policy.getStatus().getCurrentHealthy());
    }
}
