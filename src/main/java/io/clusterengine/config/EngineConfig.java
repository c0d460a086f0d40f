package io.clusterengine.config;

import io.clusterengine.util.EnvironmentUtils;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
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
import java.util.List;

import static io.clusterengine.config.Constants.*;

/**
 * Engine configuration. Loads the {@code engine} and {@code etcd} sections of application.yml
 * with fallbacks to constants, and is threaded explicitly into the components that need it.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EngineConfig {

    private final String engineId;
    private final boolean debug;
    private final boolean nameUnique;
    private final int maxNodesPerCluster;
    private final String storeBackend;
    private final String[] etcdEndpoints;
    private final String lockBackend;
    private final int lockLeaseSeconds;
    private final int dispatcherWorkers;
    private final long pollIntervalMillis;
    private final int defaultActionTimeoutSeconds;
    private final int defaultClusterTimeoutSeconds;
    private final int defaultPolicyPriority;
    private final int defaultPolicyCooldownSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "ENGINE_CONFIG_FILE";
    private static final String ENGINE_ID_ENV_VAR = "ENGINE_ID";

    public EngineConfig() {
        this(loadYamlConfig());
        log.info("Loaded engine config - id: {}, store: {}, lock: {}, workers: {}, etcd endpoints: {}",
                engineId, storeBackend, lockBackend, dispatcherWorkers, String.join(", ", etcdEndpoints));
    }

    public EngineConfig(ConfigModel config) {
        Engine engine = config.getEngine() != null ? config.getEngine() : new Engine();
        this.engineId = EnvironmentUtils.getEnv(ENGINE_ID_ENV_VAR,
                valueOrDefault(engine.getId(), DEFAULT_ENGINE_ID));
        this.debug = Boolean.TRUE.equals(engine.getDebug());
        this.nameUnique = Boolean.TRUE.equals(engine.getName_unique());
        this.maxNodesPerCluster = positiveOrDefault(engine.getMax_nodes_per_cluster(), DEFAULT_MAX_NODES_PER_CLUSTER);
        this.storeBackend = parseStoreBackend(engine);
        this.etcdEndpoints = parseEndpoints(config);
        this.lockBackend = parseLockBackend(engine);
        this.lockLeaseSeconds = engine.getLock() != null
                ? positiveOrDefault(engine.getLock().getLease_seconds(), DEFAULT_LOCK_LEASE_SECONDS)
                : DEFAULT_LOCK_LEASE_SECONDS;
        Dispatcher dispatcher = engine.getDispatcher() != null ? engine.getDispatcher() : new Dispatcher();
        this.dispatcherWorkers = positiveOrDefault(dispatcher.getWorkers(), DEFAULT_DISPATCHER_WORKERS);
        this.pollIntervalMillis = dispatcher.getPoll_interval_millis() != null && dispatcher.getPoll_interval_millis() > 0
                ? dispatcher.getPoll_interval_millis()
                : DEFAULT_POLL_INTERVAL_MILLIS;
        Defaults defaults = engine.getDefaults() != null ? engine.getDefaults() : new Defaults();
        this.defaultActionTimeoutSeconds = positiveOrDefault(defaults.getAction_timeout_seconds(), DEFAULT_ACTION_TIMEOUT_SECONDS);
        this.defaultClusterTimeoutSeconds = positiveOrDefault(defaults.getCluster_timeout_seconds(), DEFAULT_CLUSTER_TIMEOUT_SECONDS);
        this.defaultPolicyPriority = defaults.getPolicy_priority() != null && defaults.getPolicy_priority() >= 0
                ? defaults.getPolicy_priority()
                : DEFAULT_POLICY_PRIORITY;
        this.defaultPolicyCooldownSeconds = defaults.getPolicy_cooldown_seconds() != null && defaults.getPolicy_cooldown_seconds() >= 0
                ? defaults.getPolicy_cooldown_seconds()
                : DEFAULT_POLICY_COOLDOWN_SECONDS;
    }

    /**
     * Configuration with every value at its default, without reading any file.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(new ConfigModel());
    }

    private static ConfigModel loadYamlConfig() {
        Constructor constructor = new Constructor(ConfigModel.class, new LoaderOptions());
        // application.yml also carries Spring Boot sections we do not model
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
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
            }
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            inputStream = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
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

    private static String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null
                && !config.getEtcd().getEndpoints().isEmpty()) {
            return config.getEtcd().getEndpoints().toArray(new String[0]);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private static String parseStoreBackend(Engine engine) {
        if (engine.getStore() != null && STORE_BACKEND_ETCD.equalsIgnoreCase(engine.getStore().getBackend())) {
            return STORE_BACKEND_ETCD;
        }
        return STORE_BACKEND_MEMORY;
    }

    private static String parseLockBackend(Engine engine) {
        if (engine.getLock() != null && LOCK_BACKEND_ETCD.equalsIgnoreCase(engine.getLock().getBackend())) {
            return LOCK_BACKEND_ETCD;
        }
        return LOCK_BACKEND_LOCAL;
    }

    private static String valueOrDefault(String value, String defaultValue) {
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private static int positiveOrDefault(Integer value, int defaultValue) {
        return value != null && value > 0 ? value : defaultValue;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Engine engine;
        private Etcd etcd;
    }

    @Data
    public static class Engine {
        private String id;
        private Boolean debug;
        private Boolean name_unique;
        private Integer max_nodes_per_cluster;
        private Store store;
        private Lock lock;
        private Dispatcher dispatcher;
        private Defaults defaults;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Store {
        private String backend;
    }

    @Data
    public static class Lock {
        private String backend;
        private Integer lease_seconds;
    }

    @Data
    public static class Dispatcher {
        private Integer workers;
        private Long poll_interval_millis;
    }

    @Data
    public static class Defaults {
        private Integer action_timeout_seconds;
        private Integer cluster_timeout_seconds;
        private Integer policy_priority;
        private Integer policy_cooldown_seconds;
    }
}
