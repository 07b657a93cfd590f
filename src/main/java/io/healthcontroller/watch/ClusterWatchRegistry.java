package io.healthcontroller.watch;

import com.google.common.util.concurrent.AtomicDouble;
import io.healthcontroller.metrics.MetricsProvider;
import io.healthcontroller.models.ClusterConnection;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.reconcile.ReconcileQueue;
import io.healthcontroller.remote.RemoteClusterClient;
import io.healthcontroller.remote.RemoteClusterClientFactory;
import io.healthcontroller.routing.EventRouter;
import io.healthcontroller.routing.NodeChangeEvent;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import static io.healthcontroller.metrics.MetricsConstants.CLUSTER_NODE_WATCHES_METRIC_NAME;

/**
 * Process-wide registry of node watches, at most one per target cluster.
 *
 * Node changes seen by a watch are routed to the owning machine's policies and enqueued.
 * Watches stay in place until the controller stops, even after their cluster is deleted.
 */
@Slf4j
public class ClusterWatchRegistry {

    private final RemoteClusterClientFactory clientFactory;
    private final EventRouter eventRouter;
    private final ReconcileQueue reconcileQueue;
    private final Clock clock;
    private final Map<ObjectKey, ClusterWatch> watches = new ConcurrentHashMap<>();
    // watch creation is serialized per cluster, never across clusters
    private final Map<ObjectKey, ReentrantLock> clusterLocks = new ConcurrentHashMap<>();
    private final AtomicDouble watchGauge;

    public ClusterWatchRegistry(RemoteClusterClientFactory clientFactory, EventRouter eventRouter,
                                ReconcileQueue reconcileQueue, MetricsProvider metricsProvider, Clock clock) {
        this.clientFactory = clientFactory;
        this.eventRouter = eventRouter;
        this.reconcileQueue = reconcileQueue;
        this.clock = clock;
        this.watchGauge = metricsProvider.gauge(CLUSTER_NODE_WATCHES_METRIC_NAME, Collections.emptyMap());
    }

    /**
     * Make sure node changes on the cluster are being watched. Idempotent; a watch whose
     * stream failed is resynced instead of replaced.
     *
     * @return the cluster's watch
     * @throws Exception if the client could not be built or the initial node listing failed;
     *                   nothing is recorded in that case so the next call retries
     */
    public ClusterWatch ensureWatch(ObjectKey clusterKey, ClusterConnection connection) throws Exception {
        ClusterWatch current = watches.get(clusterKey);
        if (current != null && current.getInformer().hasSynced()) {
            return current;
        }

        ReentrantLock lock = clusterLocks.computeIfAbsent(clusterKey, key -> new ReentrantLock());
        lock.lock();
        try {
            ClusterWatch existing = watches.get(clusterKey);
            if (existing != null) {
                if (!existing.getInformer().hasSynced()) {
                    log.info("Resyncing node watch for cluster {}", clusterKey);
                    existing.getInformer().start();
                }
                return existing;
            }

            RemoteClusterClient client = clientFactory.newClient(clusterKey, connection);
            NodeInformer informer = new NodeInformer(clusterKey, client,
                node -> reconcileQueue.addAll(eventRouter.route(new NodeChangeEvent(clusterKey, node))));
            try {
                informer.start();
            } catch (Exception e) {
                informer.close();
                client.close();
                throw new Exception("Failed to watch nodes on target cluster " + clusterKey, e);
            }

            ClusterWatch watch = new ClusterWatch(clusterKey, client, informer, clock.instant());
            watches.put(clusterKey, watch);
            watchGauge.set(watches.size());
            log.info("Watching nodes on target cluster {}", clusterKey);
            return watch;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ClusterWatch> getWatch(ObjectKey clusterKey) {
        return Optional.ofNullable(watches.get(clusterKey));
    }

    public boolean isWatching(ObjectKey clusterKey) {
        return watches.containsKey(clusterKey);
    }

    public List<ObjectKey> watchedClusters() {
        List<ObjectKey> keys = new ArrayList<>(watches.keySet());
        keys.sort((a, b) -> a.toString().compareTo(b.toString()));
        return keys;
    }

    @PreDestroy
    public void close() {
        log.info("Stopping {} cluster node watches", watches.size());
        for (ObjectKey clusterKey : new ArrayList<>(watches.keySet())) {
            ReentrantLock lock = clusterLocks.computeIfAbsent(clusterKey, key -> new ReentrantLock());
            lock.lock();
            try {
                ClusterWatch watch = watches.remove(clusterKey);
                if (watch != null) {
                    watch.close();
                }
            } catch (RuntimeException e) {
                log.warn("Error stopping node watch for cluster {}: {}", clusterKey, e.getMessage());
            } finally {
                lock.unlock();
            }
        }
        watchGauge.set(0);
    }
}
