package io.healthcontroller.index;

import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.Machine;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

import static io.healthcontroller.config.Constants.INDEX_HEALTH_CHECK_CLUSTER_NAME;
import static io.healthcontroller.config.Constants.INDEX_MACHINE_NODE_NAME;

/**
 * Holds the cached health check policies and machines with the two lookup indexes
 * used by event routing: policies by target cluster name and machines by node name.
 */
@Slf4j
public class IndexManager {

    private final ObjectIndex<HealthCheckPolicy> healthChecks;
    private final ObjectIndex<Machine> machines;

    public IndexManager() {
        this.healthChecks = new ObjectIndex<>(HealthCheckPolicy.KIND, policy -> policy.getKey().toString());
        this.machines = new ObjectIndex<>("Machine", machine -> machine.getKey().toString());

        healthChecks.addIndexer(INDEX_HEALTH_CHECK_CLUSTER_NAME, IndexManager::indexHealthCheckByClusterName);
        machines.addIndexer(INDEX_MACHINE_NODE_NAME, IndexManager::indexMachineByNodeName);

        log.info("IndexManager initialized with indexes {} and {}", INDEX_HEALTH_CHECK_CLUSTER_NAME, INDEX_MACHINE_NODE_NAME);
    }

    public ObjectIndex<HealthCheckPolicy> getHealthChecks() {
        return healthChecks;
    }

    public ObjectIndex<Machine> getMachines() {
        return machines;
    }

    /**
     * Policies in {@code namespace} that target the cluster named {@code clusterName}.
     */
    public List<HealthCheckPolicy> listHealthChecksByClusterName(String namespace, String clusterName) {
        return healthChecks.byIndex(INDEX_HEALTH_CHECK_CLUSTER_NAME, clusterName).stream()
                .filter(policy -> namespace.equals(policy.getNamespace()))
                .collect(Collectors.toList());
    }

    /**
     * Machines, across all namespaces, whose node reference names {@code nodeName}.
     */
    public List<Machine> listMachinesByNodeName(String nodeName) {
        return machines.byIndex(INDEX_MACHINE_NODE_NAME, nodeName);
    }

    static List<String> indexHealthCheckByClusterName(HealthCheckPolicy policy) {
        if (policy.getSpec() == null || policy.getSpec().getClusterName() == null) {
            return List.of();
        }
        return List.of(policy.getSpec().getClusterName());
    }

    static List<String> indexMachineByNodeName(Machine machine) {
        if (machine.getNodeRef() == null || machine.getNodeRef().isEmpty()) {
            return List.of();
        }
        return List.of(machine.getNodeRef());
    }
}
