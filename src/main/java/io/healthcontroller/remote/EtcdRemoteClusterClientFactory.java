package io.healthcontroller.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.Client;
import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.ClusterConnection;
import io.healthcontroller.models.ObjectKey;
import io.healthcontroller.store.MetadataStore;
import io.healthcontroller.store.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Looks up a cluster's connection record in the management store and opens etcd clients from it.
 */
@Slf4j
public class EtcdRemoteClusterClientFactory implements RemoteClusterClientFactory {

    private final MetadataStore metadataStore;
    private final ObjectMapper objectMapper;

    public EtcdRemoteClusterClientFactory(MetadataStore metadataStore, ObjectMapper objectMapper) {
        this.metadataStore = metadataStore;
        this.objectMapper = objectMapper;
    }

    @Override
    public ClusterConnection buildConfig(Cluster cluster) throws Exception {
        ObjectKey clusterKey = cluster.getKey();
        ClusterConnection connection = metadataStore.getClusterConnection(clusterKey)
            .orElseThrow(() -> new ResourceNotFoundException("ClusterConnection", clusterKey));

        if (connection.getEndpoints() == null
                || connection.getEndpoints().stream().allMatch(e -> e == null || e.isBlank())) {
            throw new IllegalArgumentException("Connection for cluster " + clusterKey + " has no endpoints");
        }
        if (connection.getKeyPrefix() == null || connection.getKeyPrefix().isBlank()) {
            throw new IllegalArgumentException("Connection for cluster " + clusterKey + " has no key prefix");
        }
        return connection;
    }

    @Override
    public RemoteClusterClient newClient(ObjectKey clusterKey, ClusterConnection connection) throws Exception {
        String[] endpoints = connection.getEndpoints().stream()
            .filter(Objects::nonNull)
            .filter(e -> !e.isBlank())
            .toArray(String[]::new);
        log.info("Creating client for cluster {} with endpoints {}", clusterKey, String.join(",", endpoints));

        Client client = Client.builder().endpoints(endpoints).build();
        return new EtcdRemoteClusterClient(clusterKey, client, connection.getKeyPrefix(), objectMapper);
    }
}
