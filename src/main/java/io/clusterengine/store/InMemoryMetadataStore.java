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
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.PATH_DELIMITER;

/**
 * Process-local MetadataStore. Keeps JSON values under the same keys and with the same
 * revision semantics as the etcd store, so callers never share object instances with it.
 */
@Slf4j
public class InMemoryMetadataStore implements MetadataStore {

    private final NavigableMap<String, StoredValue> data = new TreeMap<>();
    private final EtcdPathResolver pathResolver = EtcdPathResolver.getInstance();
    private final ObjectMapper objectMapper = JsonUtils.newObjectMapper();
    private long revision = 0;

    private static final class StoredValue {
        private final String json;
        private final long modRevision;

        private StoredValue(String json, long modRevision) {
            this.json = json;
            this.modRevision = modRevision;
        }
    }

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    @Override
    public List<Cluster> getAllClusters() throws Exception {
        return listByPrefix(pathResolver.getClustersPrefix(), Cluster.class);
    }

    @Override
    public Optional<Cluster> getCluster(String clusterId) throws Exception {
        return getByPath(pathResolver.getClusterPath(clusterId), Cluster.class);
    }

    @Override
    public void createCluster(Cluster cluster) throws Exception {
        compareAndPut(pathResolver.getClusterPath(cluster.getId()), cluster, 0L);
    }

    @Override
    public void updateCluster(Cluster cluster) throws Exception {
        compareAndPut(pathResolver.getClusterPath(cluster.getId()), cluster, cluster.getRevision());
    }

    // =================================================================
    // NODE OPERATIONS
    // =================================================================

    @Override
    public List<Node> getAllNodes() throws Exception {
        return listByPrefix(pathResolver.getNodesPrefix(), Node.class);
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
        return getByPath(pathResolver.getNodePath(nodeId), Node.class);
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
    public synchronized void deleteNode(String nodeId) {
        data.remove(pathResolver.getNodePath(nodeId));
    }

    @Override
    public synchronized void commitMembership(Cluster cluster, List<Node> nodes) throws Exception {
        String clusterPath = pathResolver.getClusterPath(cluster.getId());
        checkRevision(clusterPath, cluster.getRevision());
        for (Node node : nodes) {
            checkRevision(pathResolver.getNodePath(node.getId()), node.getRevision());
        }
        long committed = ++revision;
        data.put(clusterPath, new StoredValue(objectMapper.writeValueAsString(cluster), committed));
        cluster.setRevision(committed);
        for (Node node : nodes) {
            data.put(pathResolver.getNodePath(node.getId()), new StoredValue(objectMapper.writeValueAsString(node), committed));
            node.setRevision(committed);
        }
        log.debug("Committed membership of cluster {} with {} node records at revision {}",
                cluster.getId(), nodes.size(), committed);
    }

    // =================================================================
    // PROFILE OPERATIONS
    // =================================================================

    @Override
    public List<Profile> getAllProfiles() throws Exception {
        return listByPrefix(pathResolver.getProfilesPrefix(), Profile.class);
    }

    @Override
    public Optional<Profile> getProfile(String profileId) throws Exception {
        return getByPath(pathResolver.getProfilePath(profileId), Profile.class);
    }

    @Override
    public void createProfile(Profile profile) throws Exception {
        put(pathResolver.getProfilePath(profile.getId()), profile);
    }

    @Override
    public synchronized void deleteProfile(String profileId) {
        data.remove(pathResolver.getProfilePath(profileId));
    }

    // =================================================================
    // POLICY OPERATIONS
    // =================================================================

    @Override
    public List<Policy> getAllPolicies() throws Exception {
        return listByPrefix(pathResolver.getPoliciesPrefix(), Policy.class);
    }

    @Override
    public Optional<Policy> getPolicy(String policyId) throws Exception {
        return getByPath(pathResolver.getPolicyPath(policyId), Policy.class);
    }

    @Override
    public void createPolicy(Policy policy) throws Exception {
        put(pathResolver.getPolicyPath(policy.getId()), policy);
    }

    @Override
    public synchronized void deletePolicy(String policyId) {
        data.remove(pathResolver.getPolicyPath(policyId));
    }

    // =================================================================
    // POLICY BINDING OPERATIONS
    // =================================================================

    @Override
    public List<PolicyBinding> getBindingsByCluster(String clusterId) throws Exception {
        return listByPrefix(pathResolver.getClusterBindingsPrefix(clusterId), PolicyBinding.class);
    }

    @Override
    public List<PolicyBinding> getBindingsByPolicy(String policyId) throws Exception {
        return listByPrefix(pathResolver.getBindingsPrefix(), PolicyBinding.class).stream()
                .filter(binding -> policyId.equals(binding.getPolicyId()))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<PolicyBinding> getBinding(String clusterId, String policyId) throws Exception {
        return getByPath(pathResolver.getBindingPath(clusterId, policyId), PolicyBinding.class);
    }

    @Override
    public void putBinding(PolicyBinding binding) throws Exception {
        put(pathResolver.getBindingPath(binding.getClusterId(), binding.getPolicyId()), binding);
    }

    @Override
    public synchronized void deleteBinding(String clusterId, String policyId) {
        data.remove(pathResolver.getBindingPath(clusterId, policyId));
    }

    // =================================================================
    // RECEIVER OPERATIONS
    // =================================================================

    @Override
    public List<Receiver> getAllReceivers() throws Exception {
        return listByPrefix(pathResolver.getReceiversPrefix(), Receiver.class);
    }

    @Override
    public Optional<Receiver> getReceiver(String receiverId) throws Exception {
        return getByPath(pathResolver.getReceiverPath(receiverId), Receiver.class);
    }

    @Override
    public void createReceiver(Receiver receiver) throws Exception {
        put(pathResolver.getReceiverPath(receiver.getId()), receiver);
    }

    @Override
    public synchronized void deleteReceiver(String receiverId) {
        data.remove(pathResolver.getReceiverPath(receiverId));
    }

    // =================================================================
    // ACTION LOG OPERATIONS
    // =================================================================

    @Override
    public List<Action> getAllActions() throws Exception {
        List<Action> actions = listByPrefix(pathResolver.getActionsPrefix(), Action.class);
        actions.sort(Comparator.comparing(Action::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return actions;
    }

    @Override
    public Optional<Action> getAction(String actionId) throws Exception {
        return getByPath(pathResolver.getActionPath(actionId), Action.class);
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
    public synchronized boolean updateAction(Action action) throws Exception {
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
        log.info("InMemoryMetadataStore initialized");
    }

    @Override
    public synchronized void close() {
        log.info("Closing in-memory metadata store");
        data.clear();
    }

    // =================================================================
    // PRIVATE HELPERS
    // =================================================================

    private synchronized <T> Optional<T> getByPath(String path, Class<T> clazz) throws Exception {
        StoredValue value = data.get(path);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(deserialize(value, clazz));
    }

    private synchronized <T> List<T> listByPrefix(String prefix, Class<T> clazz) throws Exception {
        String prefixWithSlash = prefix + PATH_DELIMITER;
        List<T> items = new ArrayList<>();
        for (Map.Entry<String, StoredValue> entry : data.tailMap(prefixWithSlash, true).entrySet()) {
            if (!entry.getKey().startsWith(prefixWithSlash)) {
                break;
            }
            items.add(deserialize(entry.getValue(), clazz));
        }
        return items;
    }

    private synchronized void put(String path, Object object) throws Exception {
        data.put(path, new StoredValue(objectMapper.writeValueAsString(object), ++revision));
    }

    private synchronized void compareAndPut(String path, Versioned object, long expectedRevision) throws Exception {
        checkRevision(path, expectedRevision);
        long committed = ++revision;
        data.put(path, new StoredValue(objectMapper.writeValueAsString(object), committed));
        object.setRevision(committed);
    }

    private void checkRevision(String path, long expectedRevision) {
        StoredValue current = data.get(path);
        long currentRevision = current == null ? 0L : current.modRevision;
        if (currentRevision != expectedRevision) {
            throw new ConcurrentUpdateException("Concurrent modification of " + path
                    + " (expected revision " + expectedRevision + ", found " + currentRevision + ")");
        }
    }

    private <T> T deserialize(StoredValue value, Class<T> clazz) throws Exception {
        T item = objectMapper.readValue(value.json, clazz);
        if (item instanceof Versioned) {
            ((Versioned) item).setRevision(value.modRevision);
        }
        return item;
    }
}
