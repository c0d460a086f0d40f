package io.clusterengine.membership;

import io.clusterengine.enums.EntityKind;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.exceptions.AmbiguousReferenceException;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.exceptions.ConflictException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.Profile;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.NODE_NAME_FORMAT;
import static io.clusterengine.models.Cluster.UNBOUNDED;

/**
 * Adds, removes and replaces the members of a cluster.
 *
 * Every operation comes in two halves. {@code validateXxx} runs synchronously on the
 * request path, never writes, and returns the resolved node ids. {@code xxx} runs
 * later inside an action: it re-validates against fresh state and commits the cluster
 * and all touched nodes in one atomic store write.
 *
 * Batch validation reports every offending reference of one category in a single error.
 */
@Slf4j
public class MembershipCoordinator {

    private final MetadataStore metadataStore;
    private final IdentityResolver identityResolver;
    private final Clock clock;

    public MembershipCoordinator(MetadataStore metadataStore, IdentityResolver identityResolver, Clock clock) {
        this.metadataStore = metadataStore;
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    // =================================================================
    // ADD NODES
    // =================================================================

    public List<String> validateAddNodes(Cluster cluster, List<String> nodeRefs) throws Exception {
        if (nodeRefs == null || nodeRefs.isEmpty()) {
            throw new BadRequestException("No nodes to add: [].");
        }
        checkUnique(nodeRefs);

        Map<String, Node> found = resolveAll(nodeRefs, "Nodes not found: %s.");
        checkUniqueIds(found, "Items for 'nodes' must be unique");

        List<String> owned = refsMatching(found, node -> !node.isOrphan());
        if (!owned.isEmpty()) {
            throw new ConflictException(String.format("Nodes %s already owned by some cluster.", formatList(owned)));
        }
        List<String> inactive = refsMatching(found, node -> node.getStatus() != NodeStatus.ACTIVE);
        if (!inactive.isEmpty()) {
            throw new BadRequestException(String.format("Nodes are not ACTIVE: %s.", formatList(inactive)));
        }
        checkProfileTypes(cluster, found);

        int newCapacity = cluster.getNodes().size() + found.size();
        if (cluster.getMaxSize() != UNBOUNDED && newCapacity > cluster.getMaxSize()) {
            throw new BadRequestException(String.format(
                    "The target capacity (%d) is greater than the cluster's max_size (%d).",
                    newCapacity, cluster.getMaxSize()));
        }
        return ids(found);
    }

    /**
     * Admits orphan nodes into a cluster. Each node gets a fresh index and desired
     * capacity follows the new member count.
     */
    public List<Node> addNodes(String clusterId, List<String> nodeIds) throws Exception {
        Cluster cluster = loadCluster(clusterId);
        validateAddNodes(cluster, nodeIds);

        OffsetDateTime now = now();
        List<Node> nodes = new ArrayList<>();
        for (String nodeId : nodeIds) {
            Node node = loadNode(nodeId);
            node.joinCluster(clusterId, cluster.allocateIndex());
            node.setUpdatedAt(now);
            cluster.getNodes().add(nodeId);
            nodes.add(node);
        }
        cluster.setDesiredCapacity(cluster.getNodes().size());
        cluster.setUpdatedAt(now);
        metadataStore.commitMembership(cluster, nodes);

        log.info("[Cluster: {}] Added nodes {}", clusterId, nodeIds);
        return nodes;
    }

    // =================================================================
    // DELETE NODES
    // =================================================================

    public List<String> validateDelNodes(Cluster cluster, List<String> nodeRefs) throws Exception {
        if (nodeRefs == null || nodeRefs.isEmpty()) {
            throw new BadRequestException("No nodes specified.");
        }
        checkUnique(nodeRefs);

        Map<String, Node> found = resolveAll(nodeRefs, "Nodes not found: %s.");
        checkUniqueIds(found, "Items for 'nodes' must be unique");

        List<String> orphans = refsMatching(found, Node::isOrphan);
        if (!orphans.isEmpty()) {
            throw new BadRequestException(orphans.stream()
                    .map(ref -> String.format("Node '%s' is an orphan node.", ref))
                    .collect(Collectors.joining(" ")));
        }
        List<String> foreign = refsMatching(found, node -> !cluster.getId().equals(node.getClusterId()));
        if (!foreign.isEmpty()) {
            throw new BadRequestException(String.format(
                    "Nodes not members of specified cluster: %s.", formatList(foreign)));
        }

        int newCapacity = cluster.getNodes().size() - found.size();
        if (newCapacity < cluster.getMinSize()) {
            throw new BadRequestException(String.format(
                    "The target capacity (%d) is less than the cluster's min_size (%d).",
                    newCapacity, cluster.getMinSize()));
        }
        return ids(found);
    }

    /**
     * Releases members of a cluster after validating the removal.
     */
    public List<Node> delNodes(String clusterId, List<String> nodeIds) throws Exception {
        Cluster cluster = loadCluster(clusterId);
        validateDelNodes(cluster, nodeIds);
        return releaseNodes(clusterId, nodeIds, c -> c.setDesiredCapacity(c.getNodes().size()));
    }

    // =================================================================
    // REPLACE NODES
    // =================================================================

    public Map<String, String> validateReplaceNodes(Cluster cluster, Map<String, String> replacements) throws Exception {
        if (replacements == null || replacements.isEmpty()) {
            throw new BadRequestException("No nodes to replace: {}.");
        }
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new BadRequestException(String.format("Field 'nodes[%s]' cannot be None.", entry.getKey()));
            }
        }
        if (new HashSet<>(replacements.values()).size() != replacements.size()) {
            throw new BadRequestException("Map contains duplicated values");
        }

        Map<String, Node> originals = resolveAll(new ArrayList<>(replacements.keySet()), "Original nodes not found: %s.");
        checkUniqueIds(originals, "Map contains duplicated keys");
        List<String> notMembers = refsMatching(originals, node -> !cluster.getId().equals(node.getClusterId()));
        if (!notMembers.isEmpty()) {
            throw new BadRequestException(String.format(
                    "Nodes %s are not members of the cluster %s.", formatList(notMembers), cluster.getId()));
        }

        Map<String, Node> substitutes = resolveAll(new ArrayList<>(replacements.values()), "Replacement nodes not found: %s.");
        checkUniqueIds(substitutes, "Map contains duplicated values");
        List<String> taken = refsMatching(substitutes, node -> !node.isOrphan());
        if (!taken.isEmpty()) {
            throw new ConflictException(String.format("Nodes %s already member of a cluster.", formatList(taken)));
        }
        checkProfileTypes(cluster, substitutes);

        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            resolved.put(originals.get(entry.getKey()).getId(), substitutes.get(entry.getValue()).getId());
        }
        return resolved;
    }

    /**
     * Swaps members for orphans. Each replacement takes over the index and list position
     * of the node it replaces; capacity does not change.
     */
    public void replaceNodes(String clusterId, Map<String, String> replacements) throws Exception {
        Cluster cluster = loadCluster(clusterId);
        validateReplaceNodes(cluster, replacements);

        OffsetDateTime now = now();
        List<Node> touched = new ArrayList<>();
        for (Map.Entry<String, String> entry : replacements.entrySet()) {
            Node original = loadNode(entry.getKey());
            Node substitute = loadNode(entry.getValue());

            substitute.joinCluster(clusterId, original.getIndex());
            substitute.setUpdatedAt(now);
            original.leaveCluster();
            original.setUpdatedAt(now);

            int position = cluster.getNodes().indexOf(original.getId());
            cluster.getNodes().set(position, substitute.getId());
            touched.add(original);
            touched.add(substitute);
        }
        cluster.setUpdatedAt(now);
        metadataStore.commitMembership(cluster, touched);

        log.info("[Cluster: {}] Replaced nodes {}", clusterId, replacements);
    }

    // =================================================================
    // PRIMITIVES USED BY CLUSTER AND NODE ACTIONS
    // =================================================================

    /**
     * Creates {@code count} new member records in INIT status and applies
     * {@code clusterChanges} to the cluster in the same atomic write.
     */
    public List<Node> reserveNodes(String clusterId, int count, Consumer<Cluster> clusterChanges) throws Exception {
        Cluster cluster = loadCluster(clusterId);
        OffsetDateTime now = now();
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int index = cluster.allocateIndex();
            Node node = Node.builder()
                    .id(UUID.randomUUID().toString())
                    .name(String.format(NODE_NAME_FORMAT, clusterId.substring(0, 8), index))
                    .clusterId(clusterId)
                    .profileId(cluster.getProfileId())
                    .index(index)
                    .status(NodeStatus.INIT)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            cluster.getNodes().add(node.getId());
            nodes.add(node);
        }
        clusterChanges.accept(cluster);
        cluster.setUpdatedAt(now);
        metadataStore.commitMembership(cluster, nodes);

        log.info("[Cluster: {}] Reserved {} new nodes", clusterId, count);
        return nodes;
    }

    /**
     * Turns members into orphans and applies {@code clusterChanges} in the same atomic write.
     */
    public List<Node> releaseNodes(String clusterId, List<String> nodeIds, Consumer<Cluster> clusterChanges) throws Exception {
        Cluster cluster = loadCluster(clusterId);
        OffsetDateTime now = now();
        List<Node> nodes = new ArrayList<>();
        for (String nodeId : nodeIds) {
            Node node = loadNode(nodeId);
            if (!clusterId.equals(node.getClusterId())) {
                throw new BadRequestException(String.format(
                        "Nodes not members of specified cluster: %s.", formatList(List.of(nodeId))));
            }
            node.leaveCluster();
            node.setUpdatedAt(now);
            cluster.getNodes().remove(nodeId);
            nodes.add(node);
        }
        clusterChanges.accept(cluster);
        cluster.setUpdatedAt(now);
        metadataStore.commitMembership(cluster, nodes);

        log.info("[Cluster: {}] Released nodes {}", clusterId, nodeIds);
        return nodes;
    }

    /**
     * Admits a single node into a cluster, growing desired capacity by one.
     */
    public Node joinCluster(String clusterId, String nodeId) throws Exception {
        return addNodes(clusterId, List.of(nodeId)).get(0);
    }

    /**
     * Removes a single member from its cluster, shrinking desired capacity by one.
     * Returns the node unchanged when it is already an orphan.
     */
    public Node leaveCluster(String nodeId) throws Exception {
        Node node = loadNode(nodeId);
        if (node.isOrphan()) {
            return node;
        }
        return delNodes(node.getClusterId(), List.of(nodeId)).get(0);
    }

    /**
     * Profile type of a cluster or node, resolved through its profile.
     */
    public String profileTypeOf(String profileId) throws Exception {
        return metadataStore.getProfile(profileId)
                .map(Profile::getType)
                .orElseThrow(() -> new ResourceNotFoundException(
                        String.format("The specified profile '%s' is not found.", profileId)));
    }

    /**
     * Renders a list of references as ['a', 'b'].
     */
    public static String formatList(List<String> values) {
        return values.stream().map(value -> "'" + value + "'").collect(Collectors.joining(", ", "[", "]"));
    }

    // =================================================================
    // PRIVATE HELPERS
    // =================================================================

    private void checkUnique(List<String> refs) {
        if (new LinkedHashSet<>(refs).size() != refs.size()) {
            throw new BadRequestException("Items for 'nodes' must be unique");
        }
    }

    /**
     * Two references naming the same node, e.g. once by name and once by id.
     */
    private static void checkUniqueIds(Map<String, Node> found, String message) {
        Set<String> seen = new HashSet<>();
        for (Node node : found.values()) {
            if (!seen.add(node.getId())) {
                throw new BadRequestException(message);
            }
        }
    }

    /**
     * Resolves every reference, keyed by the reference as given. Fails with one error
     * naming every reference that could not be resolved, missing or ambiguous alike.
     */
    private Map<String, Node> resolveAll(List<String> refs, String notFoundFormat) {
        Map<String, Node> found = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String ref : refs) {
            try {
                Optional<Node> node = identityResolver.findNode(Reference.parse(ref));
                if (node.isPresent()) {
                    found.put(ref, node.get());
                } else {
                    missing.add(ref);
                }
            } catch (AmbiguousReferenceException e) {
                log.debug("Node reference '{}' is ambiguous: {}", ref, e.getMessage());
                missing.add(ref);
            }
        }
        if (!missing.isEmpty()) {
            throw new BadRequestException(String.format(notFoundFormat, formatList(missing)));
        }
        return found;
    }

    private void checkProfileTypes(Cluster cluster, Map<String, Node> nodes) throws Exception {
        String clusterType = profileTypeOf(cluster.getProfileId());
        Map<String, String> typeByProfile = new HashMap<>();
        List<String> mismatched = new ArrayList<>();
        for (Map.Entry<String, Node> entry : nodes.entrySet()) {
            String profileId = entry.getValue().getProfileId();
            String nodeType = typeByProfile.containsKey(profileId)
                    ? typeByProfile.get(profileId)
                    : metadataStore.getProfile(profileId).map(Profile::getType).orElse(null);
            typeByProfile.put(profileId, nodeType);
            if (!clusterType.equals(nodeType)) {
                mismatched.add(entry.getKey());
            }
        }
        if (!mismatched.isEmpty()) {
            throw new BadRequestException(String.format(
                    "Profile type of nodes %s does not match that of the cluster.", formatList(mismatched)));
        }
    }

    private static List<String> refsMatching(Map<String, Node> nodes, Predicate<Node> predicate) {
        return nodes.entrySet().stream()
                .filter(entry -> predicate.test(entry.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static List<String> ids(Map<String, Node> nodes) {
        return nodes.values().stream().map(Node::getId).collect(Collectors.toList());
    }

    private Cluster loadCluster(String clusterId) throws Exception {
        return metadataStore.getCluster(clusterId)
                .filter(cluster -> !cluster.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException(
                        IdentityResolver.notFoundMessage(EntityKind.CLUSTER, clusterId)));
    }

    private Node loadNode(String nodeId) throws Exception {
        return metadataStore.getNode(nodeId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        IdentityResolver.notFoundMessage(EntityKind.NODE, nodeId)));
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
