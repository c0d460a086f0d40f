package io.clusterengine.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_ENGINE_ID = "engine-local";
    public static final String STORE_BACKEND_MEMORY = "memory";
    public static final String STORE_BACKEND_ETCD = "etcd";
    public static final String LOCK_BACKEND_LOCAL = "local";
    public static final String LOCK_BACKEND_ETCD = "etcd";
    public static final int DEFAULT_LOCK_LEASE_SECONDS = 60;
    public static final int DEFAULT_DISPATCHER_WORKERS = 4;
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 500L;
    public static final int DEFAULT_ACTION_TIMEOUT_SECONDS = 3600;
    public static final int DEFAULT_CLUSTER_TIMEOUT_SECONDS = 3600;
    public static final int DEFAULT_POLICY_PRIORITY = 50;
    public static final int DEFAULT_POLICY_COOLDOWN_SECONDS = 0;
    public static final int DEFAULT_MAX_NODES_PER_CLUSTER = 1000;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_ROOT = "cluster-engine";
    public static final String PATH_CLUSTERS = "clusters";
    public static final String PATH_NODES = "nodes";
    public static final String PATH_PROFILES = "profiles";
    public static final String PATH_POLICIES = "policies";
    public static final String PATH_BINDINGS = "bindings";
    public static final String PATH_RECEIVERS = "receivers";
    public static final String PATH_ACTIONS = "actions";
    public static final String PATH_LOCKS = "locks";

    // Action input and data keys
    public static final String DATA_CREATION_COUNT = "creation_count";
    public static final String DATA_DELETION_COUNT = "deletion_count";
    public static final String DATA_DELETION_CRITERIA = "deletion_criteria";
    public static final String DATA_DESTROY_AFTER_DELETION = "destroy_after_deletion";
    public static final String DATA_GRACE_PERIOD = "grace_period";
    public static final String DATA_BATCH_SIZE = "batch_size";
    public static final String DATA_CHECKED_POLICIES = "checked_policies";
    public static final String OUTPUT_NODES_ADDED = "nodes_added";
    public static final String OUTPUT_NODES_REMOVED = "nodes_removed";

    // Status reasons
    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_CANCELLED = "Action was cancelled.";
    public static final String REASON_ENGINE_DIED = "Engine died when executing this action.";

    // Node naming: node-<first 8 chars of cluster id>-<index>
    public static final String NODE_NAME_FORMAT = "node-%s-%03d";

    public static final String ACTION_LOCATION_PREFIX = "/actions/";
}
