package io.healthcontroller.watch;

import io.etcd.jetcd.Watch;
import io.healthcontroller.models.Node;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.remote.NodeReader;
import io.healthcontroller.remote.NodeSnapshot;
import io.healthcontroller.remote.NodeWatchListener;
import io.healthcontroller.remote.RemoteClusterClient;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Node cache for one target cluster, kept current by a list followed by a watch
 * from the listed revision. Every observed change is passed to the change handler.
 */
@Slf4j
public class NodeInformer implements NodeReader, NodeWatchListener {

    private final ObjectKey clusterKey;
    private final RemoteClusterClient client;
    private final Consumer<Node> onChange;
    private final Map<String, Node> nodes = new ConcurrentHashMap<>();
    private volatile Watch.Watcher watcher;
    private volatile boolean synced;

    public NodeInformer(ObjectKey clusterKey, RemoteClusterClient client, Consumer<Node> onChange) {
        this.clusterKey = clusterKey;
        this.client = client;
        this.onChange = onChange;
    }

    /**
     * List all nodes into the cache and start watching for later changes.
     * Also used to recover after the watch stream failed.
     */
    public synchronized void start() throws Exception {
        stopWatcher();
        NodeSnapshot snapshot = client.listNodes();
        nodes.clear();
        for (Node node : snapshot.getNodes()) {
            nodes.put(node.getName(), node);
        }
        watcher = client.watchNodes(snapshot.getRevision() + 1, this);
        synced = true;
        log.info("Node informer for cluster {} synced with {} nodes at revision {}",
            clusterKey, nodes.size(), snapshot.getRevision());
    }

    public boolean hasSynced() {
        return synced;
    }

    @Override
    public Optional<Node> getNode(String nodeName) {
        return Optional.ofNullable(nodes.get(nodeName));
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public void onNodeChanged(Node node) {
        nodes.put(node.getName(), node);
        notifyChange(node);
    }

    @Override
    public void onNodeDeleted(Node node) {
        Node last = nodes.remove(node.getName());
        notifyChange(last != null ? last : node);
    }

    @Override
    public void onError(Throwable error) {
        synced = false;
        log.error("Node watch for cluster {} failed, cache is stale until the next resync", clusterKey, error);
    }

    private void notifyChange(Node node) {
        try {
            onChange.accept(node);
        } catch (RuntimeException e) {
            log.error("Node change handler failed for node {} on cluster {}", node.getName(), clusterKey, e);
        }
    }

    private void stopWatcher() {
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
    }

    public synchronized void close() {
        stopWatcher();
        synced = false;
        nodes.clear();
    }
}
