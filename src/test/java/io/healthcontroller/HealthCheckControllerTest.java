package io.healthcontroller;

import io.healthcontroller.metrics.MetricsProvider;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.reconcile.ReconcileException;
import io.healthcontroller.reconcile.ReconcileQueue;
import io.healthcontroller.reconcile.ReconcileResult;
import io.healthcontroller.reconcile.Reconciler;
import io.healthcontroller.store.ManagementStoreWatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.healthcontroller.metrics.MetricsConstants.RECONCILE_TOTAL_METRIC_NAME;
import static io.healthcontroller.metrics.MetricsConstants.RESULT_TAG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HealthCheckControllerTest {

    private static final ObjectKey KEY = ObjectKey.of("ns", "p1");

    private Reconciler reconciler;
    private ReconcileQueue reconcileQueue;
    private ManagementStoreWatcher storeWatcher;
    private SimpleMeterRegistry meterRegistry;
    private HealthCheckController controller;

    @BeforeEach
    void setUp() {
        reconciler = mock(Reconciler.class);
        reconcileQueue = mock(ReconcileQueue.class);
        storeWatcher = mock(ManagementStoreWatcher.class);
        meterRegistry = new SimpleMeterRegistry();
        controller = new HealthCheckController(reconciler, reconcileQueue, storeWatcher,
            new MetricsProvider(meterRegistry, "controller-0"), 2);
    }

    private double reconcileCount(String result) {
        return meterRegistry.find(RECONCILE_TOTAL_METRIC_NAME).tag(RESULT_TAG, result).counter().count();
    }

    @Test
    void testProcessItem_Success() throws Exception {
        when(reconciler.reconcile(KEY)).thenReturn(ReconcileResult.done());

        controller.processItem(KEY);

        verify(reconcileQueue).forget(KEY);
        verify(reconcileQueue, never()).addAfter(any(), any());
        verify(reconcileQueue, never()).addRateLimited(any());
        verify(reconcileQueue).done(KEY);
        assertThat(reconcileCount("success")).isEqualTo(1.0);
    }

    @Test
    void testProcessItem_RequeueAfter() throws Exception {
        when(reconciler.reconcile(KEY)).thenReturn(ReconcileResult.requeueAfter(Duration.ofMinutes(3)));

        controller.processItem(KEY);

        verify(reconcileQueue).forget(KEY);
        verify(reconcileQueue).addAfter(KEY, Duration.ofMinutes(3));
        verify(reconcileQueue).done(KEY);
        assertThat(reconcileCount("requeue")).isEqualTo(1.0);
    }

    @Test
    void testProcessItem_FailureBacksOff() throws Exception {
        when(reconciler.reconcile(KEY)).thenThrow(new ReconcileException(KEY, "boom", null));

        controller.processItem(KEY);

        verify(reconcileQueue, never()).forget(KEY);
        verify(reconcileQueue).addRateLimited(KEY);
        verify(reconcileQueue).done(KEY);
        assertThat(reconcileCount("error")).isEqualTo(1.0);
    }

    @Test
    void testStart_WatcherFailureAbortsStartup() throws Exception {
        doThrow(new Exception("etcd down")).when(storeWatcher).start();

        assertThatThrownBy(controller::start)
            .isInstanceOf(RuntimeException.class)
            .hasMessage("HealthCheckController startup failed");
    }

    @Test
    void testWorkersDrainQueue() throws Exception {
        // Given
        ReconcileQueue realQueue = new ReconcileQueue(Duration.ofMillis(5), Duration.ofSeconds(1));
        HealthCheckController running = new HealthCheckController(reconciler, realQueue, storeWatcher,
            new MetricsProvider(meterRegistry, "controller-0"), 2);
        when(reconciler.reconcile(KEY)).thenReturn(ReconcileResult.done());

        // When
        running.start();
        realQueue.add(KEY);

        // Then
        verify(reconciler, timeout(5000)).reconcile(KEY);
        running.shutdown();
        verify(storeWatcher).stop();
        assertThat(realQueue.isShuttingDown()).isTrue();
    }
}
