package io.healthcontroller.health;

import lombok.Getter;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Aggregate verdict over all targets of a policy.
 */
@Getter
public class HealthCheckResult {

    private final int healthyCount;
    private final List<HealthCheckTarget> needsRemediation;
    private final List<Duration> nextCheckTimes;

    public HealthCheckResult(int healthyCount, List<HealthCheckTarget> needsRemediation, List<Duration> nextCheckTimes) {
        this.healthyCount = healthyCount;
        this.needsRemediation = Collections.unmodifiableList(needsRemediation);
        this.nextCheckTimes = Collections.unmodifiableList(nextCheckTimes);
    }

    /**
     * Smallest positive next-check duration, if any target is still undecided.
     */
    public Optional<Duration> minNextCheck() {
        return nextCheckTimes.stream()
            .filter(d -> !d.isZero() && !d.isNegative())
            .min(Duration::compareTo);
    }
}
