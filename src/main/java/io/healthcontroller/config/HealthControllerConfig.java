package io.healthcontroller.config;

import io.healthcontroller.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static io.healthcontroller.config.Constants.*;

/**
 * Configuration for the health controller.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class HealthControllerConfig {

    private final String[] etcdEndpoints;
    private final int maxConcurrentReconciles;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final Duration defaultNodeStartupTimeout;
    private final String controllerId;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    static final String EXTERNAL_CONFIG_ENV_VAR = "CONTROLLER_CONFIG_FILE";

    public HealthControllerConfig() {
        this(System.getenv(EXTERNAL_CONFIG_ENV_VAR));
    }

    HealthControllerConfig(String externalConfigPath) {
        ConfigModel config = loadYamlConfig(externalConfigPath);

        this.etcdEndpoints = parseEndpoints(config);
        this.maxConcurrentReconciles = parseMaxConcurrentReconciles(config);
        this.backoffBase = parseBackoffBase(config);
        this.backoffMax = parseBackoffMax(config);
        this.defaultNodeStartupTimeout = parseNodeStartupTimeout(config);
        this.controllerId = parseControllerId(config);

        log.info("Loaded health controller config - etcd endpoints: {}, workers: {}, backoff: {} .. {}",
                String.join(", ", etcdEndpoints), maxConcurrentReconciles, backoffBase, backoffMax);
    }

    private ConfigModel loadYamlConfig(String externalConfigPath) {
        Constructor constructor = new Constructor(ConfigModel.class, new LoaderOptions());
        // the same file carries Spring Boot keys (server, management, ...) that are not modeled here
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. External config file path, if any
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. Classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null
                && !config.getEtcd().getEndpoints().isEmpty()) {
            return config.getEtcd().getEndpoints().toArray(new String[0]);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private int parseMaxConcurrentReconciles(ConfigModel config) {
        Reconcile reconcile = config.getReconcile();
        if (reconcile != null && reconcile.getMax_concurrent() != null && reconcile.getMax_concurrent() > 0) {
            return reconcile.getMax_concurrent();
        }
        return DEFAULT_MAX_CONCURRENT_RECONCILES;
    }

    private Duration parseBackoffBase(ConfigModel config) {
        Reconcile reconcile = config.getReconcile();
        if (reconcile != null && reconcile.getBackoff_base_millis() != null && reconcile.getBackoff_base_millis() > 0) {
            return Duration.ofMillis(reconcile.getBackoff_base_millis());
        }
        return Duration.ofMillis(DEFAULT_BACKOFF_BASE_MILLIS);
    }

    private Duration parseBackoffMax(ConfigModel config) {
        Reconcile reconcile = config.getReconcile();
        if (reconcile != null && reconcile.getBackoff_max_seconds() != null && reconcile.getBackoff_max_seconds() > 0) {
            return Duration.ofSeconds(reconcile.getBackoff_max_seconds());
        }
        return Duration.ofSeconds(DEFAULT_BACKOFF_MAX_SECONDS);
    }

    private Duration parseNodeStartupTimeout(ConfigModel config) {
        HealthCheck healthCheck = config.getHealth_check();
        if (healthCheck != null && healthCheck.getNode_startup_timeout_minutes() != null
                && healthCheck.getNode_startup_timeout_minutes() > 0) {
            return Duration.ofMinutes(healthCheck.getNode_startup_timeout_minutes());
        }
        return Duration.ofMinutes(DEFAULT_NODE_STARTUP_TIMEOUT_MINUTES);
    }

    private String parseControllerId(ConfigModel config) {
        if (config.getController() != null && config.getController().getId() != null
                && !config.getController().getId().isBlank() && !config.getController().getId().startsWith("${")) {
            return config.getController().getId();
        }
        return EnvironmentUtils.getEnv("NODE_NAME", CONTROLLER_NAME);
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Reconcile reconcile;
        private HealthCheck health_check;
        private Controller controller;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Reconcile {
        private Integer max_concurrent;
        private Long backoff_base_millis;
        private Long backoff_max_seconds;
    }

    @Data
    public static class HealthCheck {
        private Long node_startup_timeout_minutes;
    }

    @Data
    public static class Controller {
        private String id;
    }
}
