package io.healthcontroller;

import io.healthcontroller.metrics.MetricsProvider;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.reconcile.ReconcileQueue;
import io.healthcontroller.reconcile.ReconcileResult;
import io.healthcontroller.reconcile.Reconciler;
import io.healthcontroller.store.ManagementStoreWatcher;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.healthcontroller.metrics.MetricsConstants.RECONCILE_DURATION_METRIC_NAME;
import static io.healthcontroller.metrics.MetricsConstants.RECONCILE_TOTAL_METRIC_NAME;
import static io.healthcontroller.metrics.MetricsConstants.RESULT_ERROR;
import static io.healthcontroller.metrics.MetricsConstants.RESULT_REQUEUE;
import static io.healthcontroller.metrics.MetricsConstants.RESULT_SUCCESS;
import static io.healthcontroller.metrics.MetricsConstants.RESULT_TAG;

/**
 * Runs the health check control loop: starts the store watcher that fills the reconcile
 * queue and a bounded pool of workers that drain it.
 *
 * Workers translate reconcile outcomes into queue operations:
 * - success: forget the key's failure history
 * - success with requeue delay: forget, then re-add after the delay
 * - failure: re-add with exponential backoff
 */
@Slf4j
public class HealthCheckController {

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final Reconciler reconciler;
    private final ReconcileQueue reconcileQueue;
    private final ManagementStoreWatcher storeWatcher;
    private final MetricsProvider metricsProvider;
    private final int workerCount;
    private final ExecutorService workers;

    public HealthCheckController(Reconciler reconciler, ReconcileQueue reconcileQueue,
                                 ManagementStoreWatcher storeWatcher, MetricsProvider metricsProvider,
                                 int workerCount) {
        this.reconciler = reconciler;
        this.reconcileQueue = reconcileQueue;
        this.storeWatcher = storeWatcher;
        this.metricsProvider = metricsProvider;
        this.workerCount = workerCount;
        this.workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r);
            t.setName("reconcile-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        });
        log.info("HealthCheckController initialized with {} workers", workerCount);
    }

    @PostConstruct
    public void start() {
        log.info("Starting HealthCheckController");
        try {
            storeWatcher.start();
        } catch (Exception e) {
            log.error("Failed to start HealthCheckController", e);
            throw new RuntimeException("HealthCheckController startup failed", e);
        }
        for (int i = 0; i < workerCount; i++) {
            workers.execute(this::runWorker);
        }
        log.info("HealthCheckController started");
    }

    void runWorker() {
        while (true) {
            ObjectKey key;
            try {
                key = reconcileQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (key == null) {
                return;
            }
            processItem(key);
        }
    }

    /**
     * Reconcile one key taken from the queue and release it.
     */
    void processItem(ObjectKey key) {
        long startNanos = System.nanoTime();
        String result = RESULT_ERROR;
        try {
            ReconcileResult outcome = reconciler.reconcile(key);
            reconcileQueue.forget(key);
            if (outcome.getRequeueAfter().isPresent()) {
                reconcileQueue.addAfter(key, outcome.getRequeueAfter().get());
                result = RESULT_REQUEUE;
            } else {
                result = RESULT_SUCCESS;
            }
        } catch (Exception e) {
            log.error("Reconciler error for {}, retrying with backoff", key, e);
            reconcileQueue.addRateLimited(key);
        } finally {
            reconcileQueue.done(key);
            metricsProvider.counter(RECONCILE_TOTAL_METRIC_NAME, Map.of(RESULT_TAG, result)).increment();
            metricsProvider.timer(RECONCILE_DURATION_METRIC_NAME, Map.of())
                .record(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down HealthCheckController");
        try {
            storeWatcher.stop();
            reconcileQueue.shutdown();
            workers.shutdown();
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Reconcile workers did not terminate in time, forcing shutdown");
                workers.shutdownNow();
            }
            log.info("HealthCheckController shutdown complete");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
