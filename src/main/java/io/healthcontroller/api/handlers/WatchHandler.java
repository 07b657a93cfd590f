package io.healthcontroller.api.handlers;

import io.healthcontroller.api.models.responses.WatchListResponse;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.watch.ClusterWatch;
import io.healthcontroller.watch.ClusterWatchRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * REST API handler exposing the target clusters whose nodes are watched.
 * - GET /_watches
 */
@Slf4j
@RestController
public class WatchHandler {

    private final ClusterWatchRegistry watchRegistry;

    public WatchHandler(ClusterWatchRegistry watchRegistry) {
        this.watchRegistry = watchRegistry;
    }

    @GetMapping("/_watches")
    public ResponseEntity<Object> listWatches() {
        List<WatchListResponse.WatchedCluster> clusters = new ArrayList<>();
        for (ObjectKey clusterKey : watchRegistry.watchedClusters()) {
            watchRegistry.getWatch(clusterKey).ifPresent(watch -> clusters.add(toWatchedCluster(watch)));
        }
        return ResponseEntity.ok(new WatchListResponse(clusters.size(), clusters));
    }

    private static WatchListResponse.WatchedCluster toWatchedCluster(ClusterWatch watch) {
        return new WatchListResponse.WatchedCluster(
            watch.getClusterKey().toString(),
            watch.getInformer().hasSynced(),
            watch.getInformer().size(),
            watch.getStartedAt());
    }
}
