package io.healthcontroller.routing;

import io.healthcontroller.index.IndexManager;
import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.LabelSelector;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.Node;
import io.healthcontroller.models.ObjectKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventRouterTest {

    private static final ObjectKey CLUSTER_KEY = ObjectKey.of("ns", "c1");

    private IndexManager indexManager;
    private EventRouter router;

    private static HealthCheckPolicy policy(String namespace, String name, String cluster, Map<String, String> selector) {
        HealthCheckPolicy policy = new HealthCheckPolicy(namespace, name, cluster);
        policy.getSpec().setSelector(LabelSelector.matchLabels(selector));
        return policy;
    }

    private static Machine machine(String namespace, String name, String cluster, String nodeRef, Map<String, String> labels) {
        Machine machine = new Machine(namespace, name, cluster);
        machine.setNodeRef(nodeRef);
        machine.getLabels().putAll(labels);
        return machine;
    }

    @BeforeEach
    void setUp() {
        indexManager = new IndexManager();
        router = new EventRouter(indexManager);

        indexManager.getHealthChecks().upsert(policy("ns", "workers", "c1", Map.of("role", "worker")));
        indexManager.getHealthChecks().upsert(policy("ns", "all-c1", "c1", Map.of("env", "prod")));
        indexManager.getHealthChecks().upsert(policy("ns", "other-cluster", "c2", Map.of("role", "worker")));
        indexManager.getHealthChecks().upsert(policy("other", "same-name-cluster", "c1", Map.of("role", "worker")));
    }

    @Test
    void testClusterToPolicies_SameNamespaceAndCluster() {
        List<ObjectKey> keys = router.route(new ClusterChangeEvent(new Cluster("ns", "c1")));

        assertThat(keys).containsExactlyInAnyOrder(ObjectKey.of("ns", "workers"), ObjectKey.of("ns", "all-c1"));
    }

    @Test
    void testMachineToPolicies_SelectorMustMatch() {
        Machine machine = machine("ns", "m1", "c1", "n1", Map.of("role", "worker"));

        assertThat(router.route(new MachineChangeEvent(machine))).containsExactly(ObjectKey.of("ns", "workers"));
    }

    @Test
    void testMachineToPolicies_NoClusterName() {
        Machine machine = machine("ns", "m1", null, "n1", Map.of("role", "worker"));

        assertThat(router.machineToPolicies(machine)).isEmpty();
    }

    @Test
    void testNodeToPolicies_RoutesThroughOwningMachine() {
        indexManager.getMachines().upsert(machine("ns", "m1", "c1", "n1", Map.of("role", "worker", "env", "prod")));

        List<ObjectKey> keys = router.route(new NodeChangeEvent(CLUSTER_KEY, new Node("n1")));

        assertThat(keys).containsExactlyInAnyOrder(ObjectKey.of("ns", "workers"), ObjectKey.of("ns", "all-c1"));
    }

    @Test
    void testNodeToPolicies_SameNodeNameOnAnotherCluster_IsIgnored() {
        indexManager.getMachines().upsert(machine("ns", "m1", "c1", "n1", Map.of("role", "worker")));
        indexManager.getMachines().upsert(machine("ns", "m9", "c2", "n1", Map.of("role", "worker")));

        assertThat(router.nodeToPolicies(CLUSTER_KEY, new Node("n1"))).containsExactly(ObjectKey.of("ns", "workers"));
        assertThat(router.nodeToPolicies(ObjectKey.of("ns", "c2"), new Node("n1"))).containsExactly(ObjectKey.of("ns", "other-cluster"));
    }

    @Test
    void testNodeToPolicies_ZeroOrSeveralOwners_YieldsNothing() {
        assertThat(router.nodeToPolicies(CLUSTER_KEY, new Node("orphan"))).isEmpty();

        indexManager.getMachines().upsert(machine("ns", "m1", "c1", "n1", Map.of("role", "worker")));
        indexManager.getMachines().upsert(machine("ns", "m2", "c1", "n1", Map.of("role", "worker")));

        assertThat(router.nodeToPolicies(CLUSTER_KEY, new Node("n1"))).isEmpty();
    }

    @Test
    void testRoute_InvalidInput_YieldsNothing() {
        assertThat(router.route(null)).isEmpty();
        assertThat(router.route(new ClusterChangeEvent(null))).isEmpty();
        assertThat(router.route(new MachineChangeEvent(new Machine()))).isEmpty();
        assertThat(router.route(new NodeChangeEvent(CLUSTER_KEY, new Node()))).isEmpty();
    }

    @Test
    void testLookupFailure_YieldsNothing() {
        IndexManager failing = mock(IndexManager.class);
        when(failing.listHealthChecksByClusterName("ns", "c1")).thenThrow(new IllegalStateException("cache broken"));
        EventRouter failingRouter = new EventRouter(failing);

        assertThat(failingRouter.clusterToPolicies(new Cluster("ns", "c1"))).isEmpty();
    }
}
