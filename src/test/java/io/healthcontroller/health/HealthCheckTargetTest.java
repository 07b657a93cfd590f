package io.healthcontroller.health;

import io.healthcontroller.enums.HealthVerdict;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.Node;
import io.healthcontroller.models.NodeCondition;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.models.UnhealthyCondition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HealthCheckTargetTest {

    private static final ObjectKey POLICY = ObjectKey.of("ns", "p1");
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Duration STARTUP = Duration.ofMinutes(10);
    private static final List<UnhealthyCondition> READY_RULES = List.of(
        new UnhealthyCondition("Ready", "False", Duration.ofMinutes(5)),
        new UnhealthyCondition("Ready", "Unknown", Duration.ofMinutes(5)));

    private static Machine machine(Instant created) {
        Machine machine = new Machine("ns", "m1", "c1");
        machine.setCreationTimestamp(created);
        machine.setNodeRef("n1");
        return machine;
    }

    private static Node node(String type, String status, Instant since) {
        Node node = new Node("n1");
        node.getConditions().add(new NodeCondition(type, status, since));
        return node;
    }

    @Test
    void testNoNode_WithinStartupTimeout_IsPending() {
        HealthCheckTarget target = new HealthCheckTarget(POLICY, machine(NOW.minus(Duration.ofMinutes(4))), null);

        TargetHealth health = target.check(READY_RULES, STARTUP, NOW);

        assertThat(health.getVerdict()).isEqualTo(HealthVerdict.PENDING);
        assertThat(health.getNextCheck()).contains(Duration.ofMinutes(6));
    }

    @Test
    void testNoNode_AtStartupTimeout_IsUnhealthy() {
        HealthCheckTarget target = new HealthCheckTarget(POLICY, machine(NOW.minus(STARTUP)), null);

        assertThat(target.check(READY_RULES, STARTUP, NOW).getVerdict()).isEqualTo(HealthVerdict.UNHEALTHY);
    }

    @Test
    void testNoNode_MissingCreationTimestamp_IsUnhealthy() {
        HealthCheckTarget target = new HealthCheckTarget(POLICY, machine(null), null);

        assertThat(target.check(READY_RULES, STARTUP, NOW).getVerdict()).isEqualTo(HealthVerdict.UNHEALTHY);
    }

    @Test
    void testNodeReady_IsHealthy() {
        Node node = node("Ready", "True", NOW.minus(Duration.ofHours(1)));
        HealthCheckTarget target = new HealthCheckTarget(POLICY, machine(NOW.minus(Duration.ofHours(2))), node);

        TargetHealth health = target.check(READY_RULES, STARTUP, NOW);

        assertThat(health).isEqualTo(TargetHealth.healthy());
        assertThat(target.hasNode()).isTrue();
    }

    @Test
    void testMatchingCondition_BeforeTimeout_IsPending() {
        Node node = node("Ready", "Unknown", NOW.minus(Duration.ofMinutes(2)));
        HealthCheckTarget target = new HealthCheckTarget(POLICY, machine(NOW.minus(Duration.ofHours(2))), node);

        TargetHealth health = target.check(READY_RULES, STARTUP, NOW);

        assertThat(health.getVerdict()).isEqualTo(HealthVerdict.PENDING);
        assertThat(health.getNextCheck()).contains(Duration.ofMinutes(3));
    }

    @Test
    void testMatchingCondition_AfterTimeout_IsUnhealthy() {
        Node node = node("Ready", "False", NOW.minus(Duration.ofMinutes(5)));
        HealthCheckTarget target = new HealthCheckTarget(POLICY, machine(NOW.minus(Duration.ofHours(2))), node);

        TargetHealth health = target.check(READY_RULES, STARTUP, NOW);

        assertThat(health.getVerdict()).isEqualTo(HealthVerdict.UNHEALTHY);
        assertThat(health.getReason()).startsWith("condition Ready=False");
    }

    @Test
    void testRuleWithoutTimeout_IsImmediatelyUnhealthy() {
        Node node = node("DiskPressure", "True", NOW);
        HealthCheckTarget target = new HealthCheckTarget(POLICY, machine(NOW), node);

        TargetHealth health = target.check(List.of(new UnhealthyCondition("DiskPressure", "True", null)), STARTUP, NOW);

        assertThat(health.getVerdict()).isEqualTo(HealthVerdict.UNHEALTHY);
    }

    @Test
    void testToString() {
        HealthCheckTarget withNode = new HealthCheckTarget(POLICY, machine(NOW), new Node("n1"));
        HealthCheckTarget withoutNode = new HealthCheckTarget(POLICY, machine(NOW), null);

        assertThat(withNode.toString()).isEqualTo("ns/p1/m1/n1");
        assertThat(withoutNode.toString()).isEqualTo("ns/p1/m1/");
    }
}
