package io.healthcontroller.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Paths;
import java.util.Optional;

import static io.healthcontroller.config.Constants.PATH_CLUSTERS;
import static io.healthcontroller.config.Constants.PATH_DELIMITER;
import static io.healthcontroller.config.Constants.PATH_EVENTS;
import static io.healthcontroller.config.Constants.PATH_HEALTH_CHECKS;
import static io.healthcontroller.config.Constants.PATH_MACHINES;
import static io.healthcontroller.config.Constants.PATH_NODES;
import static io.healthcontroller.config.Constants.SUFFIX_CONF;
import static io.healthcontroller.config.Constants.SUFFIX_CONNECTION;

/**
 * Centralized etcd path resolver for management store and target cluster keys.
 * Keys lead with the object kind so one prefix read covers a kind across all namespaces.
 * Stateless singleton.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    // =================================================================
    // HEALTH CHECK POLICY PATHS
    // =================================================================

    /**
     * Pattern: /health-checks
     */
    public String getAllHealthChecksPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_HEALTH_CHECKS).toString();
    }

    /**
     * Pattern: /health-checks/<namespace>
     */
    public String getHealthChecksPrefix(String namespace) {
        return Paths.get(getAllHealthChecksPrefix(), namespace).toString();
    }

    /**
     * Pattern: /health-checks/<namespace>/<name>
     */
    public String getHealthCheckPath(String namespace, String name) {
        return Paths.get(getHealthChecksPrefix(namespace), name).toString();
    }

    // =================================================================
    // CLUSTER PATHS
    // =================================================================

    /**
     * Pattern: /clusters
     */
    public String getAllClustersPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_CLUSTERS).toString();
    }

    /**
     * Pattern: /clusters/<namespace>/<name>/conf
     */
    public String getClusterConfPath(String namespace, String name) {
        return Paths.get(getAllClustersPrefix(), namespace, name, SUFFIX_CONF).toString();
    }

    /**
     * Pattern: /clusters/<namespace>/<name>/connection
     */
    public String getClusterConnectionPath(String namespace, String name) {
        return Paths.get(getAllClustersPrefix(), namespace, name, SUFFIX_CONNECTION).toString();
    }

    // =================================================================
    // MACHINE PATHS
    // =================================================================

    /**
     * Pattern: /machines
     */
    public String getAllMachinesPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_MACHINES).toString();
    }

    /**
     * Pattern: /machines/<namespace>
     */
    public String getMachinesPrefix(String namespace) {
        return Paths.get(getAllMachinesPrefix(), namespace).toString();
    }

    /**
     * Pattern: /machines/<namespace>/<name>
     */
    public String getMachinePath(String namespace, String name) {
        return Paths.get(getMachinesPrefix(namespace), name).toString();
    }

    // =================================================================
    // EVENT PATHS
    // =================================================================

    /**
     * Pattern: /events/<namespace>/<policy-name>
     */
    public String getEventsPrefix(String namespace, String policyName) {
        return Paths.get(PATH_DELIMITER, PATH_EVENTS, namespace, policyName).toString();
    }

    /**
     * Pattern: /events/<namespace>/<policy-name>/<event-id>
     */
    public String getEventPath(String namespace, String policyName, String eventId) {
        return Paths.get(getEventsPrefix(namespace, policyName), eventId).toString();
    }

    // =================================================================
    // TARGET CLUSTER PATHS
    // =================================================================

    /**
     * Pattern: <key-prefix>/nodes
     */
    public String getNodesPrefix(String keyPrefix) {
        return Paths.get(PATH_DELIMITER, keyPrefix, PATH_NODES).toString();
    }

    /**
     * Pattern: <key-prefix>/nodes/<node-name>
     */
    public String getNodePath(String keyPrefix, String nodeName) {
        return Paths.get(getNodesPrefix(keyPrefix), nodeName).toString();
    }

    // =================================================================
    // KEY PARSING
    // =================================================================

    /**
     * Split a management store key into its segments.
     * {@code /clusters/ns/c1/conf} yields kind {@code clusters}, namespace {@code ns},
     * name {@code c1} and suffix {@code conf}.
     */
    public Optional<StoreKey> parse(String key) {
        if (key == null || !key.startsWith(PATH_DELIMITER)) {
            return Optional.empty();
        }
        String[] parts = key.substring(1).split(PATH_DELIMITER);
        if (parts.length < 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            return Optional.empty();
        }
        String suffix = parts.length > 3 ? parts[3] : null;
        return Optional.of(new StoreKey(parts[0], parts[1], parts[2], suffix));
    }

    /**
     * Parsed form of a management store key.
     */
    @Getter
    @AllArgsConstructor(access = AccessLevel.PACKAGE)
    public static final class StoreKey {
        private final String kind;
        private final String namespace;
        private final String name;
        private final String suffix;
    }
}
