package io.healthcontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final int DEFAULT_MAX_CONCURRENT_RECONCILES = 4;
    public static final long DEFAULT_BACKOFF_BASE_MILLIS = 5L;
    public static final long DEFAULT_BACKOFF_MAX_SECONDS = 1000L;
    public static final long DEFAULT_NODE_STARTUP_TIMEOUT_MINUTES = 10L;

    public static final String CONTROLLER_NAME = "machinehealthcheck-controller";

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_HEALTH_CHECKS = "health-checks";
    public static final String PATH_CLUSTERS = "clusters";
    public static final String PATH_MACHINES = "machines";
    public static final String PATH_EVENTS = "events";
    public static final String PATH_NODES = "nodes";

    // etcd path suffixes
    public static final String SUFFIX_CONF = "conf";
    public static final String SUFFIX_CONNECTION = "connection";

    // Index names
    public static final String INDEX_HEALTH_CHECK_CLUSTER_NAME = "spec.clusterName";
    public static final String INDEX_MACHINE_NODE_NAME = "status.nodeRef.name";

    // Labels
    public static final String CLUSTER_NAME_LABEL = "cluster.x-k8s.io/cluster-name";

    // Event reasons
    public static final String REASON_RECONCILE_ERROR = "ReconcileError";
    public static final String REASON_MACHINE_UNHEALTHY = "MachineMarkedUnhealthy";
}
