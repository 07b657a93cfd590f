package io.healthcontroller.health;

import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.LabelSelector;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.Node;
import io.healthcontroller.remote.NodeReader;
import io.healthcontroller.store.MetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TargetResolverTest {

    private MetadataStore metadataStore;
    private NodeReader nodes;
    private TargetResolver resolver;
    private Cluster cluster;
    private HealthCheckPolicy policy;

    private static Machine machine(String name, String clusterName, String nodeRef, Map<String, String> labels) {
        Machine machine = new Machine("ns", name, clusterName);
        machine.setNodeRef(nodeRef);
        machine.getLabels().putAll(labels);
        return machine;
    }

    @BeforeEach
    void setUp() {
        metadataStore = mock(MetadataStore.class);
        nodes = mock(NodeReader.class);
        resolver = new TargetResolver(metadataStore);
        cluster = new Cluster("ns", "c1");
        policy = new HealthCheckPolicy("ns", "p1", "c1");
        policy.getSpec().setSelector(LabelSelector.matchLabels(Map.of("role", "worker")));
    }

    @Test
    void testResolveTargets_SelectsMatchingMachinesOfCluster() throws Exception {
        // Given
        when(metadataStore.listMachines("ns")).thenReturn(List.of(
            machine("m2", "c1", null, Map.of("role", "worker")),
            machine("m1", "c1", "n1", Map.of("role", "worker")),
            machine("m3", "c1", "n3", Map.of("role", "control-plane")),
            machine("m4", "c2", "n4", Map.of("role", "worker"))));
        when(nodes.getNode("n1")).thenReturn(Optional.of(new Node("n1")));

        // When
        List<HealthCheckTarget> targets = resolver.resolveTargets(nodes, cluster, policy);

        // Then
        assertThat(targets).extracting(t -> t.getMachine().getName()).containsExactly("m1", "m2");
        assertThat(targets.get(0).getNode().getName()).isEqualTo("n1");
        assertThat(targets.get(1).hasNode()).isFalse();
        assertThat(targets.get(0).getPolicyKey()).isEqualTo(policy.getKey());
    }

    @Test
    void testResolveTargets_NodeMissingFromCache() throws Exception {
        when(metadataStore.listMachines("ns")).thenReturn(List.of(machine("m1", "c1", "gone", Map.of("role", "worker"))));
        when(nodes.getNode("gone")).thenReturn(Optional.empty());

        List<HealthCheckTarget> targets = resolver.resolveTargets(nodes, cluster, policy);

        assertThat(targets).hasSize(1);
        assertThat(targets.get(0).getNode()).isNull();
    }

    @Test
    void testResolveTargets_EmptySelectorSelectsNothing() throws Exception {
        policy.getSpec().setSelector(new LabelSelector());
        when(metadataStore.listMachines("ns")).thenReturn(List.of(machine("m1", "c1", "n1", Map.of("role", "worker"))));

        assertThat(resolver.resolveTargets(nodes, cluster, policy)).isEmpty();
    }

    @Test
    void testResolveTargets_StoreFailurePropagates() throws Exception {
        when(metadataStore.listMachines("ns")).thenThrow(new Exception("etcd down"));

        assertThatThrownBy(() -> resolver.resolveTargets(nodes, cluster, policy)).hasMessage("etcd down");
    }
}
