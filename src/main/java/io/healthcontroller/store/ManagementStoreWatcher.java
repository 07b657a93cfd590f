package io.healthcontroller.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import io.healthcontroller.index.IndexManager;
import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.reconcile.ReconcileQueue;
import io.healthcontroller.routing.ClusterChangeEvent;
import io.healthcontroller.routing.EventRouter;
import io.healthcontroller.routing.MachineChangeEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static io.healthcontroller.config.Constants.PATH_DELIMITER;
import static io.healthcontroller.config.Constants.SUFFIX_CONF;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Feeds the management store into the controller: seeds the policy and machine caches,
 * enqueues every policy once, then watches policies, clusters and machines and turns
 * each change into reconcile requests.
 *
 * A failed watch stream triggers a full re-list and re-watch after a short delay.
 */
@Slf4j
public class ManagementStoreWatcher {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;
    static final long RESYNC_DELAY_SECONDS = 5;

    private final Client etcdClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final IndexManager indexManager;
    private final EventRouter eventRouter;
    private final ReconcileQueue reconcileQueue;
    private final ScheduledExecutorService resyncScheduler;
    private final List<Watch.Watcher> watchers = new ArrayList<>();
    private boolean resyncPending;
    private boolean stopped;

    public ManagementStoreWatcher(Client etcdClient, ObjectMapper objectMapper, IndexManager indexManager,
                                  EventRouter eventRouter, ReconcileQueue reconcileQueue) {
        this.etcdClient = etcdClient;
        this.pathResolver = EtcdPathResolver.getInstance();
        this.objectMapper = objectMapper;
        this.indexManager = indexManager;
        this.eventRouter = eventRouter;
        this.reconcileQueue = reconcileQueue;
        this.resyncScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "store-watcher-resync");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() throws Exception {
        stopped = false;
        closeWatchers();

        GetResponse policies = list(pathResolver.getAllHealthChecksPrefix());
        List<HealthCheckPolicy> seededPolicies = new ArrayList<>();
        for (KeyValue kv : policies.getKvs()) {
            decodePolicy(kv).ifPresent(seededPolicies::add);
        }
        indexManager.getHealthChecks().replaceAll(seededPolicies);

        GetResponse machines = list(pathResolver.getAllMachinesPrefix());
        List<Machine> seededMachines = new ArrayList<>();
        for (KeyValue kv : machines.getKvs()) {
            decode(kv, Machine.class).ifPresent(seededMachines::add);
        }
        indexManager.getMachines().replaceAll(seededMachines);

        long policiesRevision = policies.getHeader().getRevision();
        long machinesRevision = machines.getHeader().getRevision();

        watchers.add(watch(pathResolver.getAllHealthChecksPrefix(), policiesRevision + 1, this::handlePolicyEvent));
        watchers.add(watch(pathResolver.getAllClustersPrefix(), policiesRevision + 1, this::handleClusterEvent));
        watchers.add(watch(pathResolver.getAllMachinesPrefix(), machinesRevision + 1, this::handleMachineEvent));

        seededPolicies.forEach(policy -> reconcileQueue.add(policy.getKey()));
        log.info("Store watcher started: {} policies and {} machines cached, watching from revision {}",
            seededPolicies.size(), seededMachines.size(), policiesRevision + 1);
    }

    public synchronized void stop() {
        stopped = true;
        closeWatchers();
        resyncScheduler.shutdownNow();
        log.info("Store watcher stopped");
    }

    // =================================================================
    // EVENT HANDLING
    // =================================================================

    void handlePolicyEvent(WatchEvent event) {
        String key = event.getKeyValue().getKey().toString(UTF_8);
        Optional<EtcdPathResolver.StoreKey> storeKey = pathResolver.parse(key);
        if (storeKey.isEmpty()) {
            log.debug("Ignoring unexpected policy key {}", key);
            return;
        }
        ObjectKey policyKey = ObjectKey.of(storeKey.get().getNamespace(), storeKey.get().getName());

        if (event.getEventType() == WatchEvent.EventType.DELETE) {
            indexManager.getHealthChecks().delete(policyKey.toString());
        } else {
            Optional<HealthCheckPolicy> policy = decodePolicy(event.getKeyValue());
            if (policy.isEmpty()) {
                return;
            }
            indexManager.getHealthChecks().upsert(policy.get());
        }
        reconcileQueue.add(policyKey);
    }

    void handleClusterEvent(WatchEvent event) {
        String key = event.getKeyValue().getKey().toString(UTF_8);
        Optional<EtcdPathResolver.StoreKey> storeKey = pathResolver.parse(key);
        if (storeKey.isEmpty()) {
            log.debug("Ignoring unexpected cluster key {}", key);
            return;
        }

        Cluster cluster = null;
        if (SUFFIX_CONF.equals(storeKey.get().getSuffix())) {
            KeyValue kv = event.getEventType() == WatchEvent.EventType.DELETE ? event.getPrevKV() : event.getKeyValue();
            if (kv != null && !kv.getValue().isEmpty()) {
                cluster = decode(kv, Cluster.class).orElse(null);
            }
        }
        if (cluster == null) {
            // connection changes and deletes without a previous value only carry the identity
            cluster = new Cluster(storeKey.get().getNamespace(), storeKey.get().getName());
        }
        reconcileQueue.addAll(eventRouter.route(new ClusterChangeEvent(cluster)));
    }

    void handleMachineEvent(WatchEvent event) {
        String key = event.getKeyValue().getKey().toString(UTF_8);
        Optional<EtcdPathResolver.StoreKey> storeKey = pathResolver.parse(key);
        if (storeKey.isEmpty()) {
            log.debug("Ignoring unexpected machine key {}", key);
            return;
        }
        String machineKey = ObjectKey.of(storeKey.get().getNamespace(), storeKey.get().getName()).toString();

        if (event.getEventType() == WatchEvent.EventType.DELETE) {
            Optional<Machine> removed = indexManager.getMachines().delete(machineKey);
            if (removed.isEmpty() && event.getPrevKV() != null && !event.getPrevKV().getValue().isEmpty()) {
                removed = decode(event.getPrevKV(), Machine.class);
            }
            removed.ifPresent(machine -> reconcileQueue.addAll(eventRouter.route(new MachineChangeEvent(machine))));
            return;
        }

        Optional<Machine> machine = decode(event.getKeyValue(), Machine.class);
        if (machine.isEmpty()) {
            return;
        }
        Optional<Machine> previous = indexManager.getMachines().get(machineKey);
        indexManager.getMachines().upsert(machine.get());
        reconcileQueue.addAll(eventRouter.route(new MachineChangeEvent(machine.get())));

        // policies that selected the old labels need a recount as well
        if (previous.isPresent() && (!Objects.equals(previous.get().getLabels(), machine.get().getLabels())
                || !Objects.equals(previous.get().getClusterName(), machine.get().getClusterName()))) {
            reconcileQueue.addAll(eventRouter.route(new MachineChangeEvent(previous.get())));
        }
    }

    // =================================================================
    // HELPERS
    // =================================================================

    private GetResponse list(String prefix) throws Exception {
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, UTF_8);
        return etcdClient.getKVClient()
            .get(prefixBytes, GetOption.newBuilder().withPrefix(prefixBytes).build())
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private Watch.Watcher watch(String prefix, long fromRevision, Consumer<WatchEvent> handler) {
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, UTF_8);
        WatchOption option = WatchOption.newBuilder()
            .withPrefix(prefixBytes)
            .withPrevKV(true)
            .withRevision(fromRevision)
            .build();
        return etcdClient.getWatchClient().watch(prefixBytes, option,
            response -> dispatch(prefix, response, handler),
            error -> onWatchError(prefix, error));
    }

    private void dispatch(String prefix, WatchResponse response, Consumer<WatchEvent> handler) {
        for (WatchEvent event : response.getEvents()) {
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                log.error("Failed to handle watch event on {}", prefix, e);
            }
        }
    }

    synchronized void onWatchError(String prefix, Throwable error) {
        log.error("Watch on {} failed, resyncing in {}s", prefix, RESYNC_DELAY_SECONDS, error);
        if (stopped || resyncPending) {
            return;
        }
        resyncPending = true;
        resyncScheduler.schedule(this::resync, RESYNC_DELAY_SECONDS, TimeUnit.SECONDS);
    }

    private void resync() {
        synchronized (this) {
            resyncPending = false;
            if (stopped) {
                return;
            }
        }
        try {
            start();
        } catch (Exception e) {
            onWatchError("management store", e);
        }
    }

    private void closeWatchers() {
        for (Watch.Watcher watcher : watchers) {
            watcher.close();
        }
        watchers.clear();
    }

    private Optional<HealthCheckPolicy> decodePolicy(KeyValue kv) {
        Optional<HealthCheckPolicy> policy = decode(kv, HealthCheckPolicy.class);
        policy.ifPresent(p -> p.setRevision(kv.getModRevision()));
        return policy;
    }

    private <T> Optional<T> decode(KeyValue kv, Class<T> type) {
        try {
            return Optional.of(objectMapper.readValue(kv.getValue().toString(UTF_8), type));
        } catch (Exception e) {
            log.warn("Skipping unparsable {} at {}: {}", type.getSimpleName(), kv.getKey().toString(UTF_8), e.getMessage());
            return Optional.empty();
        }
    }
}
