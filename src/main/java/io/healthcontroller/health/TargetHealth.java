package io.healthcontroller.health;

import io.healthcontroller.enums.HealthVerdict;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Optional;

/**
 * Verdict for one target. Pending verdicts carry the time after which the target must be checked again.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TargetHealth {

    private final HealthVerdict verdict;
    private final String reason;
    private final Duration nextCheck;

    private TargetHealth(HealthVerdict verdict, String reason, Duration nextCheck) {
        this.verdict = verdict;
        this.reason = reason;
        this.nextCheck = nextCheck;
    }

    public static TargetHealth healthy() {
        return new TargetHealth(HealthVerdict.HEALTHY, null, null);
    }

    public static TargetHealth unhealthy(String reason) {
        return new TargetHealth(HealthVerdict.UNHEALTHY, reason, null);
    }

    public static TargetHealth pending(Duration remaining, String reason) {
        return new TargetHealth(HealthVerdict.PENDING, reason, remaining);
    }

    public Optional<Duration> getNextCheck() {
        return Optional.ofNullable(nextCheck);
    }
}
