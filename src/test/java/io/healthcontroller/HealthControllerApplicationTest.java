package io.healthcontroller;

import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.healthcontroller.config.HealthControllerConfig;
import io.healthcontroller.events.EventRecorder;
import io.healthcontroller.index.IndexManager;
import io.healthcontroller.metrics.MetricsProvider;
import io.healthcontroller.reconcile.HealthCheckReconciler;
import io.healthcontroller.reconcile.ReconcileQueue;
import io.healthcontroller.remote.RemoteClusterClientFactory;
import io.healthcontroller.routing.EventRouter;
import io.healthcontroller.store.EtcdMetadataStore;
import io.healthcontroller.watch.ClusterWatchRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Wiring tests for the beans declared by HealthControllerApplication
 */
class HealthControllerApplicationTest {

    private final HealthControllerApplication application = new HealthControllerApplication();
    private EtcdMetadataStore etcdStore;

    @BeforeEach
    void setUp() {
        EtcdMetadataStore.resetInstance();
        etcdStore = EtcdMetadataStore.createTestInstance(new String[]{"http://localhost:2379"},
                "test-node-1", mock(Client.class), mock(KV.class));
    }

    @AfterEach
    void tearDown() {
        EtcdMetadataStore.resetInstance();
    }

    @Test
    void testMetadataStoreBeanReusesSingleton() {
        HealthControllerConfig config = application.config();

        assertSame(etcdStore, application.metadataStore(config));
    }

    @Test
    void testReconcilerWiring() {
        HealthControllerConfig config = application.config();
        Clock clock = application.clock();
        MetricsProvider metricsProvider = new MetricsProvider(new SimpleMeterRegistry(), "test-node-1");
        IndexManager indexManager = application.indexManager();
        EventRouter eventRouter = application.eventRouter(indexManager);
        ReconcileQueue reconcileQueue = application.reconcileQueue(config);
        RemoteClusterClientFactory clientFactory = application.remoteClusterClientFactory(etcdStore);
        ClusterWatchRegistry watchRegistry = application.clusterWatchRegistry(
                clientFactory, eventRouter, reconcileQueue, metricsProvider, clock);
        EventRecorder eventRecorder = application.eventRecorder(etcdStore, metricsProvider, config, clock);

        HealthCheckReconciler reconciler = application.healthCheckReconciler(etcdStore, clientFactory, watchRegistry,
                application.targetResolver(etcdStore), application.healthEvaluator(config), eventRecorder,
                metricsProvider, clock);

        assertNotNull(reconciler);
        assertTrue(watchRegistry.watchedClusters().isEmpty());
        reconcileQueue.shutdown();
    }
}
