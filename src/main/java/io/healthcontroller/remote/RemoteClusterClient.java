package io.healthcontroller.remote;

import io.etcd.jetcd.Watch;
import io.healthcontroller.models.Node;
import io.healthcontroller.models.ObjectKey;

import java.util.Optional;

/**
 * Client for the node store of a single target cluster.
 */
public interface RemoteClusterClient extends AutoCloseable {

    ObjectKey getClusterKey();

    NodeSnapshot listNodes() throws Exception;

    Optional<Node> getNode(String nodeName) throws Exception;

    /**
     * Stream node changes that happen after {@code fromRevision}.
     */
    Watch.Watcher watchNodes(long fromRevision, NodeWatchListener listener);

    @Override
    void close();
}
