package io.healthcontroller;

import io.healthcontroller.config.HealthControllerConfig;
import io.healthcontroller.events.EventRecorder;
import io.healthcontroller.health.HealthEvaluator;
import io.healthcontroller.health.TargetResolver;
import io.healthcontroller.index.IndexManager;
import io.healthcontroller.metrics.MetricsProvider;
import io.healthcontroller.reconcile.HealthCheckReconciler;
import io.healthcontroller.reconcile.ReconcileQueue;
import io.healthcontroller.remote.EtcdRemoteClusterClientFactory;
import io.healthcontroller.remote.RemoteClusterClientFactory;
import io.healthcontroller.routing.EventRouter;
import io.healthcontroller.store.EtcdMetadataStore;
import io.healthcontroller.store.ManagementStoreWatcher;
import io.healthcontroller.store.MetadataStore;
import io.healthcontroller.watch.ClusterWatchRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * Main Spring Boot application class for the machine health controller.
 *
 * Watches health check policies, clusters and machines in the management etcd, watches
 * nodes in each target cluster's etcd, and keeps every policy's status in line with the
 * health of the machines it selects.
 */
@Slf4j
@SpringBootApplication
public class HealthControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Machine Health Controller");

        try {
            SpringApplication.run(HealthControllerApplication.class, args);
            log.info("Machine Health Controller started successfully");
        } catch (Exception e) {
            log.error("Failed to start Machine Health Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public HealthControllerConfig config() {
        HealthControllerConfig config = new HealthControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EtcdMetadataStore metadataStore(HealthControllerConfig config) {
        log.info("Initializing MetadataStore connection to etcd");
        try {
            EtcdMetadataStore store = EtcdMetadataStore.getInstance(config.getEtcdEndpoints());
            log.info("MetadataStore initialized successfully");
            return store;
        } catch (Exception e) {
            log.error("Failed to initialize MetadataStore: {}", e.getMessage(), e);
            throw new RuntimeException("MetadataStore initialization failed", e);
        }
    }

    @Bean
    public IndexManager indexManager() {
        return new IndexManager();
    }

    @Bean
    public EventRouter eventRouter(IndexManager indexManager) {
        return new EventRouter(indexManager);
    }

    @Bean
    public ReconcileQueue reconcileQueue(HealthControllerConfig config) {
        return new ReconcileQueue(config.getBackoffBase(), config.getBackoffMax());
    }

    @Bean
    public RemoteClusterClientFactory remoteClusterClientFactory(EtcdMetadataStore metadataStore) {
        return new EtcdRemoteClusterClientFactory(metadataStore, metadataStore.getObjectMapper());
    }

    @Bean
    public ClusterWatchRegistry clusterWatchRegistry(RemoteClusterClientFactory remoteClusterClientFactory,
                                                     EventRouter eventRouter,
                                                     ReconcileQueue reconcileQueue,
                                                     MetricsProvider metricsProvider,
                                                     Clock clock) {
        log.info("Initializing ClusterWatchRegistry");
        return new ClusterWatchRegistry(remoteClusterClientFactory, eventRouter, reconcileQueue, metricsProvider, clock);
    }

    @Bean
    public TargetResolver targetResolver(MetadataStore metadataStore) {
        return new TargetResolver(metadataStore);
    }

    @Bean
    public HealthEvaluator healthEvaluator(HealthControllerConfig config) {
        return new HealthEvaluator(config.getDefaultNodeStartupTimeout());
    }

    @Bean
    public EventRecorder eventRecorder(MetadataStore metadataStore, MetricsProvider metricsProvider,
                                       HealthControllerConfig config, Clock clock) {
        return new EventRecorder(metadataStore, metricsProvider, config.getControllerId(), clock);
    }

    @Bean
    public HealthCheckReconciler healthCheckReconciler(EtcdMetadataStore metadataStore,
                                                       RemoteClusterClientFactory remoteClusterClientFactory,
                                                       ClusterWatchRegistry clusterWatchRegistry,
                                                       TargetResolver targetResolver,
                                                       HealthEvaluator healthEvaluator,
                                                       EventRecorder eventRecorder,
                                                       MetricsProvider metricsProvider,
                                                       Clock clock) {
        log.info("Initializing HealthCheckReconciler");
        return new HealthCheckReconciler(metadataStore, remoteClusterClientFactory, clusterWatchRegistry,
            targetResolver, healthEvaluator, eventRecorder, metricsProvider, metadataStore.getObjectMapper(), clock);
    }

    @Bean
    public ManagementStoreWatcher managementStoreWatcher(EtcdMetadataStore metadataStore,
                                                         IndexManager indexManager,
                                                         EventRouter eventRouter,
                                                         ReconcileQueue reconcileQueue) {
        return new ManagementStoreWatcher(metadataStore.getEtcdClient(), metadataStore.getObjectMapper(),
            indexManager, eventRouter, reconcileQueue);
    }

    @Bean
    public HealthCheckController healthCheckController(HealthCheckReconciler healthCheckReconciler,
                                                       ReconcileQueue reconcileQueue,
                                                       ManagementStoreWatcher managementStoreWatcher,
                                                       MetricsProvider metricsProvider,
                                                       HealthControllerConfig config) {
        log.info("Initializing HealthCheckController with {} workers", config.getMaxConcurrentReconciles());
        return new HealthCheckController(healthCheckReconciler, reconcileQueue, managementStoreWatcher,
            metricsProvider, config.getMaxConcurrentReconciles());
    }
}
