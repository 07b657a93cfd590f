package io.healthcontroller.routing;

import io.healthcontroller.index.IndexManager;
import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.Node;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.selector.LabelSelectors;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps changes on clusters, machines and nodes to the health check policies that must be
 * re-evaluated. Lookups go through the cached indexes. Mapping functions never throw; a
 * failed lookup is logged and yields no requests.
 */
@Slf4j
public class EventRouter {

    private final IndexManager indexManager;

    public EventRouter(IndexManager indexManager) {
        this.indexManager = indexManager;
    }

    public List<ObjectKey> route(ObjectChangeEvent event) {
        if (event == null) {
            log.error("Expected an object change event, got null");
            return List.of();
        }
        return event.routeWith(this);
    }

    /**
     * Every policy in the cluster's namespace that targets the cluster.
     */
    public List<ObjectKey> clusterToPolicies(Cluster cluster) {
        if (cluster == null || isBlank(cluster.getNamespace()) || isBlank(cluster.getName())) {
            log.error("Expected a Cluster with namespace and name, got {}", cluster);
            return List.of();
        }
        try {
            return indexManager.listHealthChecksByClusterName(cluster.getNamespace(), cluster.getName()).stream()
                .map(HealthCheckPolicy::getKey)
                .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.error("Unable to list HealthCheckPolicies for cluster {}/{}", cluster.getNamespace(), cluster.getName(), e);
            return List.of();
        }
    }

    /**
     * Policies of the machine's cluster whose selector matches the machine's labels.
     */
    public List<ObjectKey> machineToPolicies(Machine machine) {
        if (machine == null || isBlank(machine.getNamespace()) || isBlank(machine.getName())) {
            log.error("Expected a Machine with namespace and name, got {}", machine);
            return List.of();
        }
        if (isBlank(machine.getClusterName())) {
            log.debug("Machine {}/{} has no cluster name, nothing to route", machine.getNamespace(), machine.getName());
            return List.of();
        }
        try {
            List<ObjectKey> requests = new ArrayList<>();
            for (HealthCheckPolicy policy : indexManager.listHealthChecksByClusterName(machine.getNamespace(), machine.getClusterName())) {
                if (LabelSelectors.matchesLabels(policy.getSpec().getSelector(), machine.getLabels())) {
                    requests.add(policy.getKey());
                }
            }
            return requests;
        } catch (RuntimeException e) {
            log.error("Unable to list HealthCheckPolicies for machine {}/{}", machine.getNamespace(), machine.getName(), e);
            return List.of();
        }
    }

    /**
     * Resolve the node's owning machine on the given cluster, then route as that machine.
     * Zero or several owning machines yield nothing.
     */
    public List<ObjectKey> nodeToPolicies(ObjectKey clusterKey, Node node) {
        if (node == null || isBlank(node.getName())) {
            log.error("Expected a Node with a name, got {}", node);
            return List.of();
        }
        List<Machine> owners;
        try {
            owners = indexManager.listMachinesByNodeName(node.getName()).stream()
                .filter(m -> clusterKey == null
                    || (clusterKey.getNamespace().equals(m.getNamespace()) && clusterKey.getName().equals(m.getClusterName())))
                .collect(Collectors.toList());
        } catch (RuntimeException e) {
            log.error("Unable to retrieve machine from node {}", node.getName(), e);
            return List.of();
        }
        if (owners.size() != 1) {
            log.error("Unable to retrieve machine from node {}: expecting 1 machine, got {}", node.getName(), owners.size());
            return List.of();
        }
        return machineToPolicies(owners.get(0));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
