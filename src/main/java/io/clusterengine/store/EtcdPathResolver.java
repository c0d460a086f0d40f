package io.clusterengine.store;

import java.nio.file.Paths;

import static io.clusterengine.config.Constants.*;

/**
 * Centralized etcd path resolver for all engine keys.
 * Stateless singleton.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
        // Private constructor for singleton
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    // =================================================================
    // ENTITY PATHS
    // =================================================================

    /**
     * Pattern: /cluster-engine/clusters
     */
    public String getClustersPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ROOT, PATH_CLUSTERS).toString();
    }

    /**
     * Pattern: /cluster-engine/clusters/<cluster-id>
     */
    public String getClusterPath(String clusterId) {
        return Paths.get(getClustersPrefix(), clusterId).toString();
    }

    public String getNodesPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ROOT, PATH_NODES).toString();
    }

    public String getNodePath(String nodeId) {
        return Paths.get(getNodesPrefix(), nodeId).toString();
    }

    public String getProfilesPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ROOT, PATH_PROFILES).toString();
    }

    public String getProfilePath(String profileId) {
        return Paths.get(getProfilesPrefix(), profileId).toString();
    }

    public String getPoliciesPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ROOT, PATH_POLICIES).toString();
    }

    public String getPolicyPath(String policyId) {
        return Paths.get(getPoliciesPrefix(), policyId).toString();
    }

    public String getReceiversPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ROOT, PATH_RECEIVERS).toString();
    }

    public String getReceiverPath(String receiverId) {
        return Paths.get(getReceiversPrefix(), receiverId).toString();
    }

    // =================================================================
    // BINDING PATHS
    // =================================================================

    /**
     * Pattern: /cluster-engine/bindings
     */
    public String getBindingsPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ROOT, PATH_BINDINGS).toString();
    }

    /**
     * Pattern: /cluster-engine/bindings/<cluster-id>
     */
    public String getClusterBindingsPrefix(String clusterId) {
        return Paths.get(getBindingsPrefix(), clusterId).toString();
    }

    /**
     * Pattern: /cluster-engine/bindings/<cluster-id>/<policy-id>
     */
    public String getBindingPath(String clusterId, String policyId) {
        return Paths.get(getClusterBindingsPrefix(clusterId), policyId).toString();
    }

    // =================================================================
    // ACTION AND LOCK PATHS
    // =================================================================

    public String getActionsPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ROOT, PATH_ACTIONS).toString();
    }

    public String getActionPath(String actionId) {
        return Paths.get(getActionsPrefix(), actionId).toString();
    }

    /**
     * Pattern: /cluster-engine/locks/<cluster-id>
     */
    public String getClusterLockPath(String clusterId) {
        return Paths.get(PATH_DELIMITER, PATH_ROOT, PATH_LOCKS, clusterId).toString();
    }
}
