package io.clusterengine.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.exceptions.ConcurrentUpdateException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.Policy;
import io.clusterengine.models.PolicyBinding;
import io.clusterengine.models.Profile;
import io.clusterengine.models.Receiver;
import io.clusterengine.models.Versioned;
import io.clusterengine.util.JsonUtils;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.PATH_DELIMITER;

/**
 * etcd-based implementation of MetadataStore.
 * Singleton to ensure single etcd client connection.
 */
@Slf4j
public class EtcdMetadataStore implements MetadataStore {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private static EtcdMetadataStore instance;

    private final String[] etcdEndpoints;
    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    /**
     * Private constructor for singleton pattern
     */
    private EtcdMetadataStore(String[] etcdEndpoints) {
        this(etcdEndpoints, Client.builder().endpoints(etcdEndpoints).build());
    }

    private EtcdMetadataStore(String[] etcdEndpoints, Client etcdClient) {
        this(etcdEndpoints, etcdClient, etcdClient.getKVClient());
    }

    /**
     * Test constructor with injected dependencies
     */
    private EtcdMetadataStore(String[] etcdEndpoints, Client etcdClient, KV kvClient) {
        this.etcdEndpoints = etcdEndpoints;
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;
        this.objectMapper = JsonUtils.newObjectMapper();
        this.pathResolver = EtcdPathResolver.getInstance();

        log.info("EtcdMetadataStore initialized with endpoints: {}", String.join(",", etcdEndpoints));
    }

    // =================================================================
    // SINGLETON MANAGEMENT
    // =================================================================

    /**
     * Get singleton instance
     */
    public static synchronized EtcdMetadataStore getInstance(String[] etcdEndpoints) {
        if (instance == null) {
            instance = new EtcdMetadataStore(etcdEndpoints);
        }
        return instance;
    }

    /**
     * Reset singleton instance (for testing only)
     */
    public static synchronized void resetInstance() {
        instance = null;
    }

    /**
     * Create test instance with mocked dependencies (for testing only)
     */
    public static synchronized EtcdMetadataStore createTestInstance(String[] etcdEndpoints, Client etcdClient, KV kvClient) {
        resetInstance();
        instance = new EtcdMetadataStore(etcdEndpoints, etcdClient, kvClient);
        return instance;
    }

    /**
     * Get the etcd client for use by other components (e.g. the etcd cluster lock)
     */
    public Client getEtcdClient() {
        return etcdClient;
    }

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    @Override
    public List<Cluster> getAllClusters() throws Exception {
        return getAllObjectsByPrefix(pathResolver.getClustersPrefix(), Cluster.class);
    }

    @Override
    public Optional<Cluster> getCluster(String clusterId) throws Exception {
        return getObjectByPath(pathResolver.getClusterPath(clusterId), Cluster.class);
    }

    @Override
    public void createCluster(Cluster cluster) throws Exception {
        log.debug("Creating cluster {} in etcd", cluster.getId());
        compareAndPut(pathResolver.getClusterPath(cluster.getId()), cluster, 0L);
    }

    @Override
    public void updateCluster(Cluster cluster) throws Exception {
        log.debug("Updating cluster {} at revision {}", cluster.getId(), cluster.getRevision());
        compareAndPut(pathResolver.getClusterPath(cluster.getId()), cluster, cluster.getRevision());
    }

    // =================================================================
    // NODE OPERATIONS
    // =================================================================

    @Override
    public List<Node> getAllNodes() throws Exception {
        return getAllObjectsByPrefix(pathResolver.getNodesPrefix(), Node.class);
    }

    @Override
    public List<Node> getNodesByCluster(String clusterId) throws Exception {
        return getAllNodes().stream()
                .filter(node -> clusterId.equals(node.getClusterId()))
                .sorted(Comparator.comparingInt(Node::getIndex))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Node> getNode(String nodeId) throws Exception {
        return getObjectByPath(pathResolver.getNodePath(nodeId), Node.class);
    }

    @Override
    public void createNode(Node node) throws Exception {
        compareAndPut(pathResolver.getNodePath(node.getId()), node, 0L);
    }

    @Override
    public void updateNode(Node node) throws Exception {
        compareAndPut(pathResolver.getNodePath(node.getId()), node, node.getRevision());
    }

    @Override
    public void deleteNode(String nodeId) throws Exception {
        log.debug("Deleting node {} from etcd", nodeId);
        executeEtcdDelete(pathResolver.getNodePath(nodeId));
    }

    @Override
    public void commitMembership(Cluster cluster, List<Node> nodes) throws Exception {
        List<Cmp> guards = new ArrayList<>();
        List<Op> writes = new ArrayList<>();

        ByteSequence clusterKey = toBytes(pathResolver.getClusterPath(cluster.getId()));
        guards.add(new Cmp(clusterKey, Cmp.Op.EQUAL, CmpTarget.modRevision(cluster.getRevision())));
        writes.add(Op.put(clusterKey, toBytes(objectMapper.writeValueAsString(cluster)), PutOption.DEFAULT));
        for (Node node : nodes) {
            ByteSequence nodeKey = toBytes(pathResolver.getNodePath(node.getId()));
            guards.add(new Cmp(nodeKey, Cmp.Op.EQUAL, CmpTarget.modRevision(node.getRevision())));
            writes.add(Op.put(nodeKey, toBytes(objectMapper.writeValueAsString(node)), PutOption.DEFAULT));
        }

        TxnResponse txnResponse = kvClient.txn()
                .If(guards.toArray(new Cmp[0]))
                .Then(writes.toArray(new Op[0]))
                .commit()
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        if (!txnResponse.isSucceeded()) {
            throw new ConcurrentUpdateException("Membership of cluster " + cluster.getId()
                    + " was modified concurrently. Please retry.");
        }

        long committed = txnResponse.getHeader().getRevision();
        cluster.setRevision(committed);
        nodes.forEach(node -> node.setRevision(committed));
        log.debug("Committed membership of cluster {} with {} node records using CAS", cluster.getId(), nodes.size());
    }

    // =================================================================
    // PROFILE OPERATIONS
    // =================================================================

    @Override
    public List<Profile> getAllProfiles() throws Exception {
        return getAllObjectsByPrefix(pathResolver.getProfilesPrefix(), Profile.class);
    }

    @Override
    public Optional<Profile> getProfile(String profileId) throws Exception {
        return getObjectByPath(pathResolver.getProfilePath(profileId), Profile.class);
    }

    @Override
    public void createProfile(Profile profile) throws Exception {
        storeObjectAsJson(pathResolver.getProfilePath(profile.getId()), profile);
    }

    @Override
    public void deleteProfile(String profileId) throws Exception {
        executeEtcdDelete(pathResolver.getProfilePath(profileId));
    }

    // =================================================================
    // POLICY OPERATIONS
    // =================================================================

    @Override
    public List<Policy> getAllPolicies() throws Exception {
        return getAllObjectsByPrefix(pathResolver.getPoliciesPrefix(), Policy.class);
    }

    @Override
    public Optional<Policy> getPolicy(String policyId) throws Exception {
        return getObjectByPath(pathResolver.getPolicyPath(policyId), Policy.class);
    }

    @Override
    public void createPolicy(Policy policy) throws Exception {
        storeObjectAsJson(pathResolver.getPolicyPath(policy.getId()), policy);
    }

    @Override
    public void deletePolicy(String policyId) throws Exception {
        executeEtcdDelete(pathResolver.getPolicyPath(policyId));
    }

    // =================================================================
    // POLICY BINDING OPERATIONS
    // =================================================================

    @Override
    public List<PolicyBinding> getBindingsByCluster(String clusterId) throws Exception {
        return getAllObjectsByPrefix(pathResolver.getClusterBindingsPrefix(clusterId), PolicyBinding.class);
    }

    @Override
    public List<PolicyBinding> getBindingsByPolicy(String policyId) throws Exception {
        return getAllObjectsByPrefix(pathResolver.getBindingsPrefix(), PolicyBinding.class).stream()
                .filter(binding -> policyId.equals(binding.getPolicyId()))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<PolicyBinding> getBinding(String clusterId, String policyId) throws Exception {
        return getObjectByPath(pathResolver.getBindingPath(clusterId, policyId), PolicyBinding.class);
    }

    @Override
    public void putBinding(PolicyBinding binding) throws Exception {
        storeObjectAsJson(pathResolver.getBindingPath(binding.getClusterId(), binding.getPolicyId()), binding);
    }

    @Override
    public void deleteBinding(String clusterId, String policyId) throws Exception {
        executeEtcdDelete(pathResolver.getBindingPath(clusterId, policyId));
    }

    // =================================================================
    // RECEIVER OPERATIONS
    // =================================================================

    @Override
    public List<Receiver> getAllReceivers() throws Exception {
        return getAllObjectsByPrefix(pathResolver.getReceiversPrefix(), Receiver.class);
    }

    @Override
    public Optional<Receiver> getReceiver(String receiverId) throws Exception {
        return getObjectByPath(pathResolver.getReceiverPath(receiverId), Receiver.class);
    }

    @Override
    public void createReceiver(Receiver receiver) throws Exception {
        storeObjectAsJson(pathResolver.getReceiverPath(receiver.getId()), receiver);
    }

    @Override
    public void deleteReceiver(String receiverId) throws Exception {
        executeEtcdDelete(pathResolver.getReceiverPath(receiverId));
    }

    // =================================================================
    // ACTION LOG OPERATIONS
    // =================================================================

    @Override
    public List<Action> getAllActions() throws Exception {
        List<Action> actions = getAllObjectsByPrefix(pathResolver.getActionsPrefix(), Action.class);
        actions.sort(Comparator.comparing(Action::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return actions;
    }

    @Override
    public Optional<Action> getAction(String actionId) throws Exception {
        return getObjectByPath(pathResolver.getActionPath(actionId), Action.class);
    }

    @Override
    public List<Action> getActionsByTarget(String target) throws Exception {
        return getAllActions().stream()
                .filter(action -> target.equals(action.getTarget()))
                .collect(Collectors.toList());
    }

    @Override
    public List<Action> getActionsByStatus(ActionStatus status) throws Exception {
        return getAllActions().stream()
                .filter(action -> action.getStatus() == status)
                .collect(Collectors.toList());
    }

    @Override
    public void createAction(Action action) throws Exception {
        compareAndPut(pathResolver.getActionPath(action.getId()), action, 0L);
    }

    @Override
    public boolean updateAction(Action action) throws Exception {
        try {
            compareAndPut(pathResolver.getActionPath(action.getId()), action, action.getRevision());
            return true;
        } catch (ConcurrentUpdateException e) {
            log.debug("Lost update race on action {}", action.getId());
            return false;
        }
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    @Override
    public void initialize() {
        log.info("Initialize called - already done in constructor");
    }

    @Override
    public void close() throws Exception {
        log.info("Closing etcd metadata store");
        try {
            if (etcdClient != null) {
                etcdClient.close();
                log.info("etcd client closed successfully");
            }
        } catch (Exception e) {
            log.error("Error closing etcd client: {}", e.getMessage(), e);
            throw new Exception("Failed to close etcd client", e);
        }
    }

    // =================================================================
    // PRIVATE HELPER METHODS FOR ETCD OPERATIONS
    // =================================================================

    /**
     * Executes etcd prefix query to retrieve all keys matching the given prefix
     */
    private GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        // Add trailing slash for etcd prefix queries to ensure precise matching
        ByteSequence prefixBytes = toBytes(prefix + PATH_DELIMITER);
        return kvClient.get(
            prefixBytes,
            GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd get operation for a single key
     */
    private GetResponse executeEtcdGet(String key) throws Exception {
        return kvClient.get(toBytes(key)).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd put operation for a key-value pair
     */
    private void executeEtcdPut(String key, String value) throws Exception {
        kvClient.put(toBytes(key), toBytes(value)).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd delete operation for a key
     */
    private void executeEtcdDelete(String key) throws Exception {
        kvClient.delete(toBytes(key)).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Puts the object only if the key is still at the expected mod revision (0 = absent).
     */
    private void compareAndPut(String path, Versioned object, long expectedRevision) throws Exception {
        ByteSequence keyBytes = toBytes(path);
        ByteSequence valueBytes = toBytes(objectMapper.writeValueAsString(object));

        TxnResponse txnResponse = kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(expectedRevision)))
            .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
            .Else(Op.get(keyBytes, GetOption.DEFAULT))
            .commit()
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        if (!txnResponse.isSucceeded()) {
            throw new ConcurrentUpdateException("Failed to update " + path
                    + " due to concurrent modification. Please retry.");
        }
        object.setRevision(txnResponse.getHeader().getRevision());
    }

    private <T> List<T> deserializeObjectList(GetResponse response, Class<T> clazz) throws Exception {
        List<T> items = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            items.add(deserialize(kv, clazz));
        }
        return items;
    }

    private <T> T deserialize(KeyValue kv, Class<T> clazz) throws Exception {
        T item = objectMapper.readValue(kv.getValue().toString(StandardCharsets.UTF_8), clazz);
        if (item instanceof Versioned) {
            ((Versioned) item).setRevision(kv.getModRevision());
        }
        return item;
    }

    /**
     * Retrieves all objects of a specific type using etcd prefix query
     */
    private <T> List<T> getAllObjectsByPrefix(String prefix, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdPrefixQuery(prefix);
        return deserializeObjectList(response, clazz);
    }

    /**
     * Retrieves single object by etcd path
     */
    private <T> Optional<T> getObjectByPath(String path, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdGet(path);
        if (response.getCount() == 0) {
            return Optional.empty();
        }
        return Optional.of(deserialize(response.getKvs().get(0), clazz));
    }

    /**
     * Stores object as JSON at the specified etcd path
     */
    private void storeObjectAsJson(String path, Object object) throws Exception {
        executeEtcdPut(path, objectMapper.writeValueAsString(object));
    }

    private static ByteSequence toBytes(String value) {
        return ByteSequence.from(value, StandardCharsets.UTF_8);
    }
}
