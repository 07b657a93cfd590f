package io.healthcontroller.remote;

import io.healthcontroller.models.Cluster;
import io.healthcontroller.models.ClusterConnection;
import io.healthcontroller.models.ObjectKey;

/**
 * Builds connection settings and clients for target clusters.
 */
public interface RemoteClusterClientFactory {

    /**
     * Resolve the connection settings of a cluster.
     *
     * @throws Exception if the settings are missing or unusable
     */
    ClusterConnection buildConfig(Cluster cluster) throws Exception;

    RemoteClusterClient newClient(ObjectKey clusterKey, ClusterConnection connection) throws Exception;
}
