package io.healthcontroller.reconcile;

import io.healthcontroller.models.ObjectKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Deduplicating work queue of policy keys.
 *
 * <ul>
 *   <li>a key waiting in the queue is not added twice</li>
 *   <li>a key is handed to at most one worker at a time; re-adds while it is being
 *       processed are deferred until {@link #done(ObjectKey)}</li>
 *   <li>failures back off exponentially per key until {@link #forget(ObjectKey)}</li>
 * </ul>
 */
@Slf4j
public class ReconcileQueue {

    private final Object monitor = new Object();
    private final Deque<ObjectKey> queue = new ArrayDeque<>();
    private final Set<ObjectKey> dirty = new HashSet<>();
    private final Set<ObjectKey> processing = new HashSet<>();
    private final Map<ObjectKey, Integer> failures = new ConcurrentHashMap<>();
    private final ScheduledExecutorService delayScheduler;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private boolean shuttingDown;

    public ReconcileQueue(Duration backoffBase, Duration backoffMax) {
        this.backoffBase = backoffBase;
        this.backoffMax = backoffMax;
        this.delayScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reconcile-queue-delay");
            t.setDaemon(true);
            return t;
        });
    }

    public void add(ObjectKey key) {
        synchronized (monitor) {
            if (shuttingDown) {
                return;
            }
            if (!dirty.add(key)) {
                return;
            }
            if (processing.contains(key)) {
                return;
            }
            queue.addLast(key);
            monitor.notify();
        }
    }

    public void addAll(Collection<ObjectKey> keys) {
        keys.forEach(this::add);
    }

    /**
     * Add the key once {@code delay} has elapsed.
     */
    public void addAfter(ObjectKey key, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            add(key);
            return;
        }
        synchronized (monitor) {
            if (shuttingDown) {
                return;
            }
            delayScheduler.schedule(() -> add(key), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Add the key after its current backoff, doubling the backoff for the next failure.
     */
    public void addRateLimited(ObjectKey key) {
        Duration backoff = nextBackoff(key);
        log.debug("Requeueing {} after {}ms backoff", key, backoff.toMillis());
        addAfter(key, backoff);
    }

    Duration nextBackoff(ObjectKey key) {
        int exponent = failures.merge(key, 1, Integer::sum) - 1;
        double millis = backoffBase.toMillis() * Math.pow(2, exponent);
        if (millis >= backoffMax.toMillis()) {
            return backoffMax;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Clear the failure history of a key.
     */
    public void forget(ObjectKey key) {
        failures.remove(key);
    }

    public int getFailures(ObjectKey key) {
        return failures.getOrDefault(key, 0);
    }

    /**
     * Block until a key is available.
     *
     * @return the next key, or null once the queue is shut down
     */
    public ObjectKey take() throws InterruptedException {
        synchronized (monitor) {
            while (queue.isEmpty() && !shuttingDown) {
                monitor.wait();
            }
            if (shuttingDown) {
                return null;
            }
            ObjectKey key = queue.pollFirst();
            processing.add(key);
            dirty.remove(key);
            return key;
        }
    }

    /**
     * Mark a key taken with {@link #take()} as finished.
     */
    public void done(ObjectKey key) {
        synchronized (monitor) {
            processing.remove(key);
            if (dirty.contains(key) && !shuttingDown) {
                queue.addLast(key);
                monitor.notify();
            }
        }
    }

    public int length() {
        synchronized (monitor) {
            return queue.size();
        }
    }

    public boolean isShuttingDown() {
        synchronized (monitor) {
            return shuttingDown;
        }
    }

    public void shutdown() {
        synchronized (monitor) {
            shuttingDown = true;
            monitor.notifyAll();
        }
        delayScheduler.shutdownNow();
        log.info("Reconcile queue shut down");
    }
}
