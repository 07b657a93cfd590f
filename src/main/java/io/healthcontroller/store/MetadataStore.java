package io.healthcontroller.store;

import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.ClusterConnection;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.models.PolicyEvent;

import java.util.List;
import java.util.Optional;

/**
 * Management store holding health check policies, clusters, machines and policy events.
 */
public interface MetadataStore {

    // =================================================================
    // HEALTH CHECK POLICY OPERATIONS
    // =================================================================

    /**
     * Get a policy with its store revision set, or empty if it does not exist.
     */
    Optional<HealthCheckPolicy> getHealthCheck(ObjectKey key) throws Exception;

    List<HealthCheckPolicy> listHealthChecks(String namespace) throws Exception;

    List<HealthCheckPolicy> listAllHealthChecks() throws Exception;

    /**
     * Write a policy back, succeeding only if it is unchanged since {@link HealthCheckPolicy#getRevision()}.
     * A revision of zero means the policy must not exist yet.
     *
     * @return the new store revision of the policy
     * @throws ConflictException if another writer changed or created the policy in the meantime
     */
    long updateHealthCheck(HealthCheckPolicy policy) throws Exception;

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    Optional<Cluster> getCluster(ObjectKey key) throws Exception;

    /**
     * Connection settings used to reach the cluster's own node store.
     */
    Optional<ClusterConnection> getClusterConnection(ObjectKey key) throws Exception;

    // =================================================================
    // MACHINE OPERATIONS
    // =================================================================

    List<Machine> listMachines(String namespace) throws Exception;

    List<Machine> listAllMachines() throws Exception;

    // =================================================================
    // EVENT OPERATIONS
    // =================================================================

    void recordEvent(PolicyEvent event) throws Exception;

    List<PolicyEvent> listEvents(ObjectKey policyKey) throws Exception;

    void close() throws Exception;
}
