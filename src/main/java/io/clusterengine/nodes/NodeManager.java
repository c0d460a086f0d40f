package io.clusterengine.nodes;

import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.actions.ActionRef;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.NodeCreateInput;
import io.clusterengine.actions.inputs.NodeUpdateInput;
import io.clusterengine.api.models.requests.NodeCreateRequest;
import io.clusterengine.api.models.requests.NodeUpdateRequest;
import io.clusterengine.enums.ActionName;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.membership.MembershipCoordinator;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.models.Profile;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import static io.clusterengine.models.Cluster.UNBOUNDED;

/**
 * Request path of node operations. Like clusters, nodes are only mutated by their
 * queued actions.
 */
@Slf4j
public class NodeManager {

    private final MetadataStore metadataStore;
    private final IdentityResolver identityResolver;
    private final MembershipCoordinator membershipCoordinator;
    private final ActionEnvelope actionEnvelope;

    public NodeManager(MetadataStore metadataStore,
                       IdentityResolver identityResolver,
                       MembershipCoordinator membershipCoordinator,
                       ActionEnvelope actionEnvelope) {
        this.metadataStore = metadataStore;
        this.identityResolver = identityResolver;
        this.membershipCoordinator = membershipCoordinator;
        this.actionEnvelope = actionEnvelope;
    }

    /**
     * Queues creation of a node, optionally as a member of an existing cluster.
     */
    public ActionRef createNode(NodeCreateRequest request) throws Exception {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new BadRequestException("The 'name' field is required.");
        }
        if (request.getProfileId() == null || request.getProfileId().isBlank()) {
            throw new BadRequestException("The 'profile_id' field is required.");
        }
        Profile profile = resolveProfileForRequest(request.getProfileId());

        String clusterId = null;
        if (request.getClusterId() != null) {
            Cluster cluster = identityResolver.resolveCluster(Reference.parse(request.getClusterId()));
            String clusterType = membershipCoordinator.profileTypeOf(cluster.getProfileId());
            if (!Objects.equals(clusterType, profile.getType())) {
                throw new BadRequestException("Node and cluster have different profile types, operation aborted.");
            }
            int newCapacity = cluster.getNodes().size() + 1;
            if (cluster.getMaxSize() != UNBOUNDED && newCapacity > cluster.getMaxSize()) {
                throw new BadRequestException(String.format(
                        "The target capacity (%d) is greater than the cluster's max_size (%d).",
                        newCapacity, cluster.getMaxSize()));
            }
            clusterId = cluster.getId();
        }

        String nodeId = UUID.randomUUID().toString();
        NodeCreateInput input = NodeCreateInput.builder()
                .name(request.getName())
                .profileId(profile.getId())
                .clusterId(clusterId)
                .role(request.getRole())
                .metadata(request.getMetadata())
                .build();
        Action action = actionEnvelope.submit(ActionName.NODE_CREATE, nodeId, ActionInputs.toMap(input), null);

        log.info("Creation of node '{}' ({}) queued as action {}", request.getName(), nodeId, action.getId());
        return new ActionRef(nodeId, action.getId());
    }

    /**
     * Nodes ordered by creation time, only the members of {@code clusterReference} when given.
     */
    public List<Node> listNodes(Reference clusterReference) throws Exception {
        List<Node> nodes;
        if (clusterReference != null) {
            Cluster cluster = identityResolver.resolveCluster(clusterReference);
            nodes = metadataStore.getNodesByCluster(cluster.getId());
        } else {
            nodes = metadataStore.getAllNodes();
        }
        return nodes.stream()
                .sorted(Comparator.comparing(Node::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    public Node getNode(Reference reference) {
        return identityResolver.resolveNode(reference);
    }

    public ActionRef updateNode(Reference reference, NodeUpdateRequest request) throws Exception {
        Node node = identityResolver.resolveNode(reference);
        if (request == null || request.isEmpty()) {
            throw new BadRequestException("No property needs an update.");
        }

        String profileId = null;
        if (request.getProfileId() != null) {
            Profile profile = resolveProfileForRequest(request.getProfileId());
            if (!profile.getId().equals(node.getProfileId())) {
                String currentType = membershipCoordinator.profileTypeOf(node.getProfileId());
                if (!Objects.equals(currentType, profile.getType())) {
                    throw new BadRequestException("Cannot update a node to a different profile type, operation aborted.");
                }
                profileId = profile.getId();
            }
        }

        NodeUpdateInput input = NodeUpdateInput.builder()
                .name(request.getName())
                .profileId(profileId)
                .role(request.getRole())
                .metadata(request.getMetadata())
                .build();
        return submit(ActionName.NODE_UPDATE, node, input);
    }

    /**
     * Queues deletion of a node. A member node leaves its cluster first, which must not
     * drop the cluster below its min_size.
     */
    public ActionRef deleteNode(Reference reference) throws Exception {
        Node node = identityResolver.resolveNode(reference);
        if (!node.isOrphan()) {
            Cluster cluster = identityResolver.resolveCluster(Reference.byId(node.getClusterId()));
            int newCapacity = cluster.getNodes().size() - 1;
            if (newCapacity < cluster.getMinSize()) {
                throw new BadRequestException(String.format(
                        "The target capacity (%d) is less than the cluster's min_size (%d).",
                        newCapacity, cluster.getMinSize()));
            }
        }
        return submit(ActionName.NODE_DELETE, node, null);
    }

    private ActionRef submit(ActionName name, Node node, Object payload) throws Exception {
        Action action = actionEnvelope.submit(name, node.getId(), ActionInputs.toMap(payload), null);
        log.info("{} of node {} queued as action {}", name, node.getId(), action.getId());
        return ActionRef.of(action.getId());
    }

    private Profile resolveProfileForRequest(String profileRef) {
        try {
            return identityResolver.resolveProfile(Reference.parse(profileRef));
        } catch (ResourceNotFoundException e) {
            throw new BadRequestException(String.format("The specified profile '%s' is not found.", profileRef));
        }
    }
}
