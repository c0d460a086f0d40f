package io.clusterengine.store;

import io.clusterengine.enums.ActionStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.Policy;
import io.clusterengine.models.PolicyBinding;
import io.clusterengine.models.Profile;
import io.clusterengine.models.Receiver;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for engine entities and the action log.
 *
 * Clusters, nodes and actions carry the revision they were read at; updates of those
 * entities are compare-and-swap and throw
 * {@link io.clusterengine.exceptions.ConcurrentUpdateException} when the stored
 * revision moved on. Returned objects are copies: mutating them has no effect until
 * they are written back.
 */
public interface MetadataStore {

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    /**
     * All clusters, including soft-deleted ones.
     */
    List<Cluster> getAllClusters() throws Exception;

    Optional<Cluster> getCluster(String clusterId) throws Exception;

    void createCluster(Cluster cluster) throws Exception;

    void updateCluster(Cluster cluster) throws Exception;

    // =================================================================
    // NODE OPERATIONS
    // =================================================================

    List<Node> getAllNodes() throws Exception;

    /**
     * Members of a cluster ordered by index.
     */
    List<Node> getNodesByCluster(String clusterId) throws Exception;

    Optional<Node> getNode(String nodeId) throws Exception;

    void createNode(Node node) throws Exception;

    void updateNode(Node node) throws Exception;

    void deleteNode(String nodeId) throws Exception;

    /**
     * Writes a cluster and a set of nodes in one atomic step. Fails as a whole when any
     * of the records changed since it was read.
     */
    void commitMembership(Cluster cluster, List<Node> nodes) throws Exception;

    // =================================================================
    // PROFILE OPERATIONS
    // =================================================================

    List<Profile> getAllProfiles() throws Exception;

    Optional<Profile> getProfile(String profileId) throws Exception;

    void createProfile(Profile profile) throws Exception;

    void deleteProfile(String profileId) throws Exception;

    // =================================================================
    // POLICY OPERATIONS
    // =================================================================

    List<Policy> getAllPolicies() throws Exception;

    Optional<Policy> getPolicy(String policyId) throws Exception;

    void createPolicy(Policy policy) throws Exception;

    void deletePolicy(String policyId) throws Exception;

    // =================================================================
    // POLICY BINDING OPERATIONS
    // =================================================================

    List<PolicyBinding> getBindingsByCluster(String clusterId) throws Exception;

    List<PolicyBinding> getBindingsByPolicy(String policyId) throws Exception;

    Optional<PolicyBinding> getBinding(String clusterId, String policyId) throws Exception;

    void putBinding(PolicyBinding binding) throws Exception;

    void deleteBinding(String clusterId, String policyId) throws Exception;

    // =================================================================
    // RECEIVER OPERATIONS
    // =================================================================

    List<Receiver> getAllReceivers() throws Exception;

    Optional<Receiver> getReceiver(String receiverId) throws Exception;

    void createReceiver(Receiver receiver) throws Exception;

    void deleteReceiver(String receiverId) throws Exception;

    // =================================================================
    // ACTION LOG OPERATIONS
    // =================================================================

    List<Action> getAllActions() throws Exception;

    Optional<Action> getAction(String actionId) throws Exception;

    List<Action> getActionsByTarget(String target) throws Exception;

    List<Action> getActionsByStatus(ActionStatus status) throws Exception;

    void createAction(Action action) throws Exception;

    /**
     * Compare-and-swap update of an action against the revision it was read at.
     *
     * @return false when another writer updated the action first
     */
    boolean updateAction(Action action) throws Exception;

    // =================================================================
    // LIFECYCLE
    // =================================================================

    void initialize() throws Exception;

    void close() throws Exception;
}
