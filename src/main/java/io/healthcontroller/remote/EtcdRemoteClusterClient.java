package io.healthcontroller.remote;

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
import io.healthcontroller.models.Node;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.store.EtcdPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.healthcontroller.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Reads nodes that a target cluster publishes under {@code <key-prefix>/nodes/} in its own etcd.
 */
@Slf4j
public class EtcdRemoteClusterClient implements RemoteClusterClient {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final ObjectKey clusterKey;
    private final Client etcdClient;
    private final String keyPrefix;
    private final ObjectMapper objectMapper;
    private final EtcdPathResolver pathResolver = EtcdPathResolver.getInstance();

    public EtcdRemoteClusterClient(ObjectKey clusterKey, Client etcdClient, String keyPrefix, ObjectMapper objectMapper) {
        this.clusterKey = clusterKey;
        this.etcdClient = etcdClient;
        this.keyPrefix = keyPrefix;
        this.objectMapper = objectMapper;
    }

    @Override
    public ObjectKey getClusterKey() {
        return clusterKey;
    }

    @Override
    public NodeSnapshot listNodes() throws Exception {
        ByteSequence prefix = nodesPrefix();
        GetResponse response = etcdClient.getKVClient()
            .get(prefix, GetOption.newBuilder().withPrefix(prefix).build())
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        List<Node> nodes = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            try {
                nodes.add(decode(kv));
            } catch (Exception e) {
                log.warn("Skipping unparsable node at {} on cluster {}: {}", kv.getKey().toString(UTF_8), clusterKey, e.getMessage());
            }
        }
        log.debug("Listed {} nodes on cluster {} at revision {}", nodes.size(), clusterKey, response.getHeader().getRevision());
        return new NodeSnapshot(nodes, response.getHeader().getRevision());
    }

    @Override
    public Optional<Node> getNode(String nodeName) throws Exception {
        GetResponse response = etcdClient.getKVClient()
            .get(ByteSequence.from(pathResolver.getNodePath(keyPrefix, nodeName), UTF_8))
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(decode(response.getKvs().get(0)));
    }

    @Override
    public Watch.Watcher watchNodes(long fromRevision, NodeWatchListener listener) {
        ByteSequence prefix = nodesPrefix();
        WatchOption option = WatchOption.newBuilder()
            .withPrefix(prefix)
            .withPrevKV(true)
            .withRevision(fromRevision)
            .build();

        log.info("Watching nodes on cluster {} from revision {}", clusterKey, fromRevision);
        return etcdClient.getWatchClient().watch(prefix, option,
            response -> dispatch(response, listener),
            listener::onError);
    }

    void dispatch(WatchResponse response, NodeWatchListener listener) {
        for (WatchEvent event : response.getEvents()) {
            String key = event.getKeyValue().getKey().toString(UTF_8);
            try {
                switch (event.getEventType()) {
                    case PUT:
                        listener.onNodeChanged(decode(event.getKeyValue()));
                        break;
                    case DELETE:
                        listener.onNodeDeleted(deletedNode(event, key));
                        break;
                    default:
                        log.debug("Ignoring unrecognized watch event on {}", key);
                }
            } catch (Exception e) {
                log.warn("Failed to handle node event for {} on cluster {}: {}", key, clusterKey, e.getMessage());
            }
        }
    }

    private Node deletedNode(WatchEvent event, String key) throws Exception {
        KeyValue prev = event.getPrevKV();
        if (prev != null && !prev.getValue().isEmpty()) {
            return decode(prev);
        }
        return new Node(key.substring(key.lastIndexOf(PATH_DELIMITER) + 1));
    }

    private Node decode(KeyValue kv) throws Exception {
        return objectMapper.readValue(kv.getValue().toString(UTF_8), Node.class);
    }

    private ByteSequence nodesPrefix() {
        return ByteSequence.from(pathResolver.getNodesPrefix(keyPrefix) + PATH_DELIMITER, UTF_8);
    }

    @Override
    public void close() {
        log.info("Closing client for cluster {}", clusterKey);
        etcdClient.close();
    }
}
