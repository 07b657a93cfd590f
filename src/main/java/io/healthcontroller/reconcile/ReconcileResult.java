package io.healthcontroller.reconcile;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a successful reconciliation pass: done, or ask to be re-run after a delay.
 */
@ToString
@EqualsAndHashCode
public final class ReconcileResult {

    private static final ReconcileResult DONE = new ReconcileResult(null);

    private final Duration requeueAfter;

    private ReconcileResult(Duration requeueAfter) {
        this.requeueAfter = requeueAfter;
    }

    public static ReconcileResult done() {
        return DONE;
    }

    public static ReconcileResult requeueAfter(Duration delay) {
        if (delay == null || delay.isNegative() || delay.isZero()) {
            throw new IllegalArgumentException("Requeue delay must be positive, got " + delay);
        }
        return new ReconcileResult(delay);
    }

    public Optional<Duration> getRequeueAfter() {
        return Optional.ofNullable(requeueAfter);
    }

    public boolean isRequeue() {
        return requeueAfter != null;
    }
}
