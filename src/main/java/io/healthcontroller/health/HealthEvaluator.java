package io.healthcontroller.health;

import io.healthcontroller.models.HealthCheckPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies every target of a policy and aggregates the verdicts.
 */
@Slf4j
public class HealthEvaluator {

    private final Duration defaultNodeStartupTimeout;

    public HealthEvaluator(Duration defaultNodeStartupTimeout) {
        this.defaultNodeStartupTimeout = defaultNodeStartupTimeout;
    }

    public HealthCheckResult evaluate(List<HealthCheckTarget> targets, HealthCheckPolicy policy, Instant now) {
        Duration startupTimeout = nodeStartupTimeout(policy);
        int healthy = 0;
        List<HealthCheckTarget> needsRemediation = new ArrayList<>();
        List<Duration> nextCheckTimes = new ArrayList<>();

        for (HealthCheckTarget target : targets) {
            TargetHealth health = target.check(policy.getSpec().getUnhealthyConditions(), startupTimeout, now);
            switch (health.getVerdict()) {
                case HEALTHY:
                    healthy++;
                    break;
                case UNHEALTHY:
                    log.debug("Target {} is unhealthy: {}", target, health.getReason());
                    needsRemediation.add(target);
                    break;
                case PENDING:
                    log.debug("Target {} is not yet decidable ({}), next check in {}", target, health.getReason(),
                        health.getNextCheck().orElse(Duration.ZERO));
                    health.getNextCheck().ifPresent(nextCheckTimes::add);
                    break;
                default:
                    throw new IllegalStateException("Unexpected verdict " + health.getVerdict());
            }
        }
        return new HealthCheckResult(healthy, needsRemediation, nextCheckTimes);
    }

    Duration nodeStartupTimeout(HealthCheckPolicy policy) {
        Duration configured = policy.getSpec().getNodeStartupTimeout();
        return configured != null ? configured : defaultNodeStartupTimeout;
    }
}
