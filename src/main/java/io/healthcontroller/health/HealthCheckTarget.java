package io.healthcontroller.health;

import io.healthcontroller.models.Machine;
import io.healthcontroller.models.Node;
import io.healthcontroller.models.NodeCondition;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.models.UnhealthyCondition;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A machine selected by a policy, paired with its node when the node is known.
 */
@Getter
public class HealthCheckTarget {

    private final ObjectKey policyKey;
    private final Machine machine;
    private final Node node;

    public HealthCheckTarget(ObjectKey policyKey, Machine machine, Node node) {
        this.policyKey = policyKey;
        this.machine = machine;
        this.node = node;
    }

    public boolean hasNode() {
        return node != null;
    }

    /**
     * Classify this target at {@code now}.
     *
     * @param conditions     unhealthy-condition rules, first match wins
     * @param startupTimeout how long a machine may exist without a node
     */
    public TargetHealth check(List<UnhealthyCondition> conditions, Duration startupTimeout, Instant now) {
        if (node == null) {
            Instant created = machine.getCreationTimestamp() != null ? machine.getCreationTimestamp() : Instant.EPOCH;
            Duration age = Duration.between(created, now);
            if (age.compareTo(startupTimeout) >= 0) {
                return TargetHealth.unhealthy("node has not appeared within " + startupTimeout);
            }
            return TargetHealth.pending(startupTimeout.minus(age), "waiting for node");
        }

        if (conditions != null) {
            for (UnhealthyCondition rule : conditions) {
                NodeCondition matched = findCondition(rule);
                if (matched == null) {
                    continue;
                }
                Duration timeout = rule.getTimeout() != null ? rule.getTimeout() : Duration.ZERO;
                Instant since = matched.getLastTransitionTime() != null ? matched.getLastTransitionTime() : Instant.EPOCH;
                Duration elapsed = Duration.between(since, now);
                String reason = "condition " + rule.getType() + "=" + rule.getStatus();
                if (elapsed.compareTo(timeout) >= 0) {
                    return TargetHealth.unhealthy(reason + " for " + elapsed);
                }
                return TargetHealth.pending(timeout.minus(elapsed), reason);
            }
        }
        return TargetHealth.healthy();
    }

    private NodeCondition findCondition(UnhealthyCondition rule) {
        if (node.getConditions() == null) {
            return null;
        }
        for (NodeCondition condition : node.getConditions()) {
            if (Objects.equals(condition.getType(), rule.getType())
                    && Objects.equals(condition.getStatus(), rule.getStatus())) {
                return condition;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        String nodeName = node != null ? node.getName() : "";
        return policyKey + "/" + machine.getName() + "/" + nodeName;
    }
}
