package io.healthcontroller.health;

import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.Node;
import io.healthcontroller.remote.NodeReader;
import io.healthcontroller.selector.LabelSelectors;
import io.healthcontroller.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a policy into the list of machines it covers, each paired with its node.
 */
@Slf4j
public class TargetResolver {

    private final MetadataStore metadataStore;

    public TargetResolver(MetadataStore metadataStore) {
        this.metadataStore = metadataStore;
    }

    /**
     * Machines of {@code cluster} in the policy's namespace whose labels match the policy selector,
     * ordered by machine name. An empty or invalid selector selects nothing.
     */
    public List<HealthCheckTarget> resolveTargets(NodeReader nodes, Cluster cluster, HealthCheckPolicy policy) throws Exception {
        List<Machine> machines = new ArrayList<>();
        for (Machine machine : metadataStore.listMachines(policy.getNamespace())) {
            if (!cluster.getName().equals(machine.getClusterName())) {
                continue;
            }
            if (LabelSelectors.matchesLabels(policy.getSpec().getSelector(), machine.getLabels())) {
                machines.add(machine);
            }
        }
        machines.sort(Comparator.comparing(Machine::getName));

        List<HealthCheckTarget> targets = new ArrayList<>(machines.size());
        for (Machine machine : machines) {
            Node node = null;
            if (machine.getNodeRef() != null && !machine.getNodeRef().isEmpty()) {
                node = nodes.getNode(machine.getNodeRef()).orElse(null);
                if (node == null) {
                    log.debug("Node {} of machine {} not found in cache of cluster {}",
                        machine.getNodeRef(), machine.getName(), cluster.getKey());
                }
            }
            targets.add(new HealthCheckTarget(policy.getKey(), machine, node));
        }
        log.debug("Resolved {} targets for {}", targets.size(), policy.getKey());
        return targets;
    }
}
