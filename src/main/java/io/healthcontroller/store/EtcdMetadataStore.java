package io.healthcontroller.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.ClusterConnection;
import io.healthcontroller.models.HealthCheckPolicy;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.models.PolicyEvent;
import io.healthcontroller.util.EnvironmentUtils;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static io.healthcontroller.config.Constants.CONTROLLER_NAME;
import static io.healthcontroller.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-based implementation of MetadataStore.
 * Singleton to ensure single etcd client connection.
 */
@Slf4j
public class EtcdMetadataStore implements MetadataStore {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;
    private static final long EVENT_TTL_SECONDS = 3600;

    private static EtcdMetadataStore instance;

    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final String nodeId;
    private final AtomicLong eventSequence = new AtomicLong();

    private EtcdMetadataStore(String[] etcdEndpoints) {
        this.nodeId = EnvironmentUtils.getEnv("NODE_NAME", CONTROLLER_NAME);
        this.objectMapper = newObjectMapper();
        this.etcdClient = Client.builder().endpoints(etcdEndpoints).build();
        this.kvClient = etcdClient.getKVClient();
        this.pathResolver = EtcdPathResolver.getInstance();

        log.info("EtcdMetadataStore initialized with endpoints: {} and nodeId: {}",
            String.join(",", etcdEndpoints), nodeId);
    }

    /**
     * Test constructor with injected dependencies
     */
    private EtcdMetadataStore(String[] etcdEndpoints, String nodeId, Client etcdClient, KV kvClient) {
        this.nodeId = nodeId;
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;
        this.objectMapper = newObjectMapper();
        this.pathResolver = EtcdPathResolver.getInstance();

        log.info("EtcdMetadataStore initialized for testing with nodeId: {}", nodeId);
    }

    // =================================================================
    // SINGLETON MANAGEMENT
    // =================================================================

    public static synchronized EtcdMetadataStore getInstance(String[] etcdEndpoints) {
        if (instance == null) {
            instance = new EtcdMetadataStore(etcdEndpoints);
        }
        return instance;
    }

    /**
     * Get existing instance (throws if not initialized)
     */
    public static EtcdMetadataStore getInstance() {
        if (instance == null) {
            throw new IllegalStateException("EtcdMetadataStore not initialized. Call getInstance(etcdEndpoints) first.");
        }
        return instance;
    }

    /**
     * Reset singleton instance (for testing only)
     */
    public static synchronized void resetInstance() {
        instance = null;
    }

    /**
     * Create test instance with mocked dependencies (for testing only)
     */
    public static synchronized EtcdMetadataStore createTestInstance(String[] etcdEndpoints, String nodeId,
                                                                    Client etcdClient, KV kvClient) {
        resetInstance();
        instance = new EtcdMetadataStore(etcdEndpoints, nodeId, etcdClient, kvClient);
        return instance;
    }

    /**
     * Mapper shared by everything that reads or writes store JSON.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    public Client getEtcdClient() {
        return etcdClient;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String getNodeId() {
        return nodeId;
    }

    // =================================================================
    // HEALTH CHECK POLICY OPERATIONS
    // =================================================================

    @Override
    public Optional<HealthCheckPolicy> getHealthCheck(ObjectKey key) throws Exception {
        log.debug("Getting health check policy {} from etcd", key);

        try {
            String path = pathResolver.getHealthCheckPath(key.getNamespace(), key.getName());
            Optional<KeyValue> kv = getKeyValue(path);
            if (kv.isEmpty()) {
                log.debug("Health check policy {} not found in etcd", key);
                return Optional.empty();
            }
            return Optional.of(decodePolicy(kv.get()));
        } catch (Exception e) {
            log.error("Failed to get health check policy {} from etcd: {}", key, e.getMessage(), e);
            throw new Exception("Failed to retrieve health check policy from etcd", e);
        }
    }

    @Override
    public List<HealthCheckPolicy> listHealthChecks(String namespace) throws Exception {
        try {
            return decodePolicies(getKeyValuesByPrefix(pathResolver.getHealthChecksPrefix(namespace)));
        } catch (Exception e) {
            log.error("Failed to list health check policies in namespace {} from etcd: {}", namespace, e.getMessage(), e);
            throw new Exception("Failed to list health check policies from etcd", e);
        }
    }

    @Override
    public List<HealthCheckPolicy> listAllHealthChecks() throws Exception {
        try {
            return decodePolicies(getKeyValuesByPrefix(pathResolver.getAllHealthChecksPrefix()));
        } catch (Exception e) {
            log.error("Failed to list health check policies from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to list health check policies from etcd", e);
        }
    }

    @Override
    public long updateHealthCheck(HealthCheckPolicy policy) throws Exception {
        ObjectKey key = policy.getKey();
        String path = pathResolver.getHealthCheckPath(key.getNamespace(), key.getName());
        ByteSequence keyBytes = ByteSequence.from(path, UTF_8);

        try {
            ByteSequence valueBytes = ByteSequence.from(objectMapper.writeValueAsString(policy), UTF_8);

            // revision 0 means create-only: the key must not exist yet
            Cmp guard = policy.getRevision() > 0
                ? new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(policy.getRevision()))
                : new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.version(0));

            TxnResponse txnResponse = kvClient.txn()
                .If(guard)
                .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
                .commit()
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            if (!txnResponse.isSucceeded()) {
                throw new ConflictException("Health check policy " + key + " was modified concurrently (expected revision "
                    + policy.getRevision() + ")");
            }

            long newRevision = txnResponse.getHeader().getRevision();
            policy.setRevision(newRevision);
            log.debug("Updated health check policy {} at revision {}", key, newRevision);
            return newRevision;
        } catch (ConflictException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to update health check policy {} in etcd: {}", key, e.getMessage(), e);
            throw new Exception("Failed to update health check policy in etcd", e);
        }
    }

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    @Override
    public Optional<Cluster> getCluster(ObjectKey key) throws Exception {
        try {
            String path = pathResolver.getClusterConfPath(key.getNamespace(), key.getName());
            return getObjectByPath(path, Cluster.class);
        } catch (Exception e) {
            log.error("Failed to get cluster {} from etcd: {}", key, e.getMessage(), e);
            throw new Exception("Failed to retrieve cluster from etcd", e);
        }
    }

    @Override
    public Optional<ClusterConnection> getClusterConnection(ObjectKey key) throws Exception {
        try {
            String path = pathResolver.getClusterConnectionPath(key.getNamespace(), key.getName());
            return getObjectByPath(path, ClusterConnection.class);
        } catch (Exception e) {
            log.error("Failed to get connection for cluster {} from etcd: {}", key, e.getMessage(), e);
            throw new Exception("Failed to retrieve cluster connection from etcd", e);
        }
    }

    // =================================================================
    // MACHINE OPERATIONS
    // =================================================================

    @Override
    public List<Machine> listMachines(String namespace) throws Exception {
        try {
            return decodeAll(getKeyValuesByPrefix(pathResolver.getMachinesPrefix(namespace)), Machine.class);
        } catch (Exception e) {
            log.error("Failed to list machines in namespace {} from etcd: {}", namespace, e.getMessage(), e);
            throw new Exception("Failed to list machines from etcd", e);
        }
    }

    @Override
    public List<Machine> listAllMachines() throws Exception {
        try {
            return decodeAll(getKeyValuesByPrefix(pathResolver.getAllMachinesPrefix()), Machine.class);
        } catch (Exception e) {
            log.error("Failed to list machines from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to list machines from etcd", e);
        }
    }

    // =================================================================
    // EVENT OPERATIONS
    // =================================================================

    @Override
    public void recordEvent(PolicyEvent event) throws Exception {
        try {
            if (event.getReportingController() == null) {
                event.setReportingController(nodeId);
            }
            String eventId = event.getTimestamp().toEpochMilli() + "-" + eventSequence.incrementAndGet();
            String path = pathResolver.getEventPath(event.getNamespace(), event.getInvolvedObjectName(), eventId);
            // events expire with their lease so repeated reconciles do not grow the keyspace
            long leaseId = etcdClient.getLeaseClient().grant(EVENT_TTL_SECONDS)
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .getID();
            kvClient.put(
                ByteSequence.from(path, UTF_8),
                ByteSequence.from(objectMapper.writeValueAsString(event), UTF_8),
                PutOption.newBuilder().withLeaseId(leaseId).build()
            ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.debug("Recorded {} event {} for {}/{} (leaseId: {})", event.getType(), event.getReason(),
                event.getNamespace(), event.getInvolvedObjectName(), leaseId);
        } catch (Exception e) {
            log.error("Failed to record event {} in etcd: {}", event.getReason(), e.getMessage(), e);
            throw new Exception("Failed to record event in etcd", e);
        }
    }

    @Override
    public List<PolicyEvent> listEvents(ObjectKey policyKey) throws Exception {
        try {
            List<PolicyEvent> events = decodeAll(
                getKeyValuesByPrefix(pathResolver.getEventsPrefix(policyKey.getNamespace(), policyKey.getName())),
                PolicyEvent.class);
            events.sort(Comparator.comparing(PolicyEvent::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder())));
            return events;
        } catch (Exception e) {
            log.error("Failed to list events for {} from etcd: {}", policyKey, e.getMessage(), e);
            throw new Exception("Failed to list events from etcd", e);
        }
    }

    // =================================================================
    // HELPERS
    // =================================================================

    private Optional<KeyValue> getKeyValue(String path) throws Exception {
        GetResponse response = kvClient.get(ByteSequence.from(path, UTF_8))
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(response.getKvs().get(0));
    }

    private List<KeyValue> getKeyValuesByPrefix(String prefix) throws Exception {
        // trailing delimiter keeps "/machines/ns" from matching "/machines/ns2"
        String prefixWithDelimiter = prefix.endsWith(PATH_DELIMITER) ? prefix : prefix + PATH_DELIMITER;
        ByteSequence prefixBytes = ByteSequence.from(prefixWithDelimiter, UTF_8);
        GetOption option = GetOption.newBuilder().withPrefix(prefixBytes).build();
        GetResponse response = kvClient.get(prefixBytes, option)
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        log.debug("Etcd returned {} keys for prefix '{}'", response.getKvs().size(), prefixWithDelimiter);
        return response.getKvs();
    }

    private <T> Optional<T> getObjectByPath(String path, Class<T> type) throws Exception {
        Optional<KeyValue> kv = getKeyValue(path);
        if (kv.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(kv.get().getValue().toString(UTF_8), type));
    }

    private HealthCheckPolicy decodePolicy(KeyValue kv) throws Exception {
        HealthCheckPolicy policy = objectMapper.readValue(kv.getValue().toString(UTF_8), HealthCheckPolicy.class);
        policy.setRevision(kv.getModRevision());
        return policy;
    }

    private List<HealthCheckPolicy> decodePolicies(List<KeyValue> kvs) {
        List<HealthCheckPolicy> policies = new ArrayList<>();
        for (KeyValue kv : kvs) {
            try {
                policies.add(decodePolicy(kv));
            } catch (Exception e) {
                log.warn("Skipping unparsable health check policy at {}: {}", kv.getKey().toString(UTF_8), e.getMessage());
            }
        }
        return policies;
    }

    private <T> List<T> decodeAll(List<KeyValue> kvs, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (KeyValue kv : kvs) {
            try {
                result.add(objectMapper.readValue(kv.getValue().toString(UTF_8), type));
            } catch (Exception e) {
                log.warn("Skipping unparsable {} at {}: {}", type.getSimpleName(), kv.getKey().toString(UTF_8), e.getMessage());
            }
        }
        return result;
    }

    @Override
    @PreDestroy
    public void close() throws Exception {
        log.info("Closing etcd metadata store");
        try {
            if (etcdClient != null) {
                etcdClient.close();
                log.info("etcd client closed successfully");
            }
        } catch (Exception e) {
            log.error("Error closing etcd client: {}", e.getMessage(), e);
            throw e;
        }
    }
}
