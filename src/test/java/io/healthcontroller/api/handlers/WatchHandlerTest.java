package io.healthcontroller.api.handlers;

import io.healthcontroller.api.models.responses.WatchListResponse;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.remote.RemoteClusterClient;
import io.healthcontroller.watch.ClusterWatch;
import io.healthcontroller.watch.ClusterWatchRegistry;
import io.healthcontroller.watch.NodeInformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WatchHandlerTest {

    @Mock
    private ClusterWatchRegistry watchRegistry;

    @InjectMocks
    private WatchHandler watchHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testListWatches_Success() {
        // Given
        ObjectKey clusterKey = ObjectKey.of("ns", "c1");
        NodeInformer informer = mock(NodeInformer.class);
        when(informer.hasSynced()).thenReturn(true);
        when(informer.size()).thenReturn(3);
        Instant startedAt = Instant.parse("2024-05-01T12:00:00Z");
        ClusterWatch watch = new ClusterWatch(clusterKey, mock(RemoteClusterClient.class), informer, startedAt);
        when(watchRegistry.watchedClusters()).thenReturn(List.of(clusterKey));
        when(watchRegistry.getWatch(clusterKey)).thenReturn(Optional.of(watch));

        // When
        ResponseEntity<Object> response = watchHandler.listWatches();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        WatchListResponse body = (WatchListResponse) response.getBody();
        assertThat(body.getCount()).isEqualTo(1);
        WatchListResponse.WatchedCluster cluster = body.getClusters().get(0);
        assertThat(cluster.getCluster()).isEqualTo("ns/c1");
        assertThat(cluster.isSynced()).isTrue();
        assertThat(cluster.getCachedNodes()).isEqualTo(3);
        assertThat(cluster.getStartedAt()).isEqualTo(startedAt);
    }

    @Test
    void testListWatches_Empty() {
        when(watchRegistry.watchedClusters()).thenReturn(List.of());

        WatchListResponse body = (WatchListResponse) watchHandler.listWatches().getBody();

        assertThat(body.getCount()).isZero();
        assertThat(body.getClusters()).isEmpty();
    }
}
