package io.healthcontroller.watch;

import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.remote.RemoteClusterClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * An established node watch on one target cluster, with the client it runs on.
 */
@Slf4j
@Getter
public class ClusterWatch {

    private final ObjectKey clusterKey;
    private final RemoteClusterClient client;
    private final NodeInformer informer;
    private final Instant startedAt;

    public ClusterWatch(ObjectKey clusterKey, RemoteClusterClient client, NodeInformer informer, Instant startedAt) {
        this.clusterKey = clusterKey;
        this.client = client;
        this.informer = informer;
        this.startedAt = startedAt;
    }

    public void close() {
        log.info("Stopping node watch for cluster {}", clusterKey);
        try {
            informer.close();
        } finally {
            client.close();
        }
    }
}
