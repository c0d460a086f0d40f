package io.clusterengine.clusters;

import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.actions.ActionRef;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.ClusterCreateInput;
import io.clusterengine.actions.inputs.ClusterUpdateInput;
import io.clusterengine.actions.inputs.NodeListInput;
import io.clusterengine.actions.inputs.PolicyBindingInput;
import io.clusterengine.actions.inputs.ReplaceNodesInput;
import io.clusterengine.actions.inputs.ScaleInput;
import io.clusterengine.api.models.requests.ClusterCreateRequest;
import io.clusterengine.api.models.requests.ClusterUpdateRequest;
import io.clusterengine.api.models.requests.NodeListRequest;
import io.clusterengine.api.models.requests.PolicyBindingRequest;
import io.clusterengine.api.models.requests.ReplaceNodesRequest;
import io.clusterengine.api.models.requests.ScaleRequest;
import io.clusterengine.capacity.CapacityRequest;
import io.clusterengine.capacity.CapacityResolver;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.AdjustmentType;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.exceptions.ConflictException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.identity.Reference;
import io.clusterengine.membership.MembershipCoordinator;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.PolicyBinding;
import io.clusterengine.models.Profile;
import io.clusterengine.policies.PolicyBindingManager;
import io.clusterengine.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import static io.clusterengine.models.Cluster.UNBOUNDED;

/**
 * Request path of every cluster operation.
 *
 * Each mutating call validates against the current state, never writes it, and hands
 * the work to the dispatcher as one WAITING action. Callers poll the returned action.
 */
@Slf4j
public class ClusterManager {

    private final MetadataStore metadataStore;
    private final IdentityResolver identityResolver;
    private final CapacityResolver capacityResolver;
    private final MembershipCoordinator membershipCoordinator;
    private final PolicyBindingManager policyBindingManager;
    private final ActionEnvelope actionEnvelope;
    private final EngineConfig config;

    public ClusterManager(MetadataStore metadataStore,
                          IdentityResolver identityResolver,
                          CapacityResolver capacityResolver,
                          MembershipCoordinator membershipCoordinator,
                          PolicyBindingManager policyBindingManager,
                          ActionEnvelope actionEnvelope,
                          EngineConfig config) {
        this.metadataStore = metadataStore;
        this.identityResolver = identityResolver;
        this.capacityResolver = capacityResolver;
        this.membershipCoordinator = membershipCoordinator;
        this.policyBindingManager = policyBindingManager;
        this.actionEnvelope = actionEnvelope;
        this.config = config;
    }

    // =================================================================
    // CLUSTER LIFECYCLE
    // =================================================================

    /**
     * Validates a new cluster and queues its creation. The cluster id is allocated here
     * and returned with the action so callers can poll both.
     */
    public ActionRef createCluster(ClusterCreateRequest request) throws Exception {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new BadRequestException("The 'name' field is required.");
        }
        if (request.getProfileId() == null || request.getProfileId().isBlank()) {
            throw new BadRequestException("The 'profile_id' field is required.");
        }
        checkNameUnique(request.getName());

        int desired = request.getDesiredCapacity() != null ? request.getDesiredCapacity() : 0;
        int min = request.getMinSize() != null ? request.getMinSize() : 0;
        int max = request.getMaxSize() != null ? request.getMaxSize() : UNBOUNDED;
        int timeout = request.getTimeout() != null ? request.getTimeout() : config.getDefaultClusterTimeoutSeconds();
        checkTimeout(timeout);
        capacityResolver.checkInitialSize(desired, min, max);

        Profile profile = resolveProfileForRequest(request.getProfileId());

        String clusterId = UUID.randomUUID().toString();
        ClusterCreateInput input = ClusterCreateInput.builder()
                .name(request.getName())
                .profileId(profile.getId())
                .desiredCapacity(desired)
                .minSize(min)
                .maxSize(max)
                .timeout(timeout)
                .metadata(request.getMetadata())
                .build();
        Action action = actionEnvelope.submit(ActionName.CLUSTER_CREATE, clusterId, ActionInputs.toMap(input), timeout);

        log.info("[Cluster: {}] Creation of '{}' queued as action {}", clusterId, request.getName(), action.getId());
        return new ActionRef(clusterId, action.getId());
    }

    public List<Cluster> listClusters() throws Exception {
        return metadataStore.getAllClusters().stream()
                .filter(cluster -> !cluster.isDeleted())
                .sorted(Comparator.comparing(Cluster::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    public Cluster getCluster(Reference reference) {
        return identityResolver.resolveCluster(reference);
    }

    public ActionRef updateCluster(Reference reference, ClusterUpdateRequest request) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        if (request == null || request.isEmpty()) {
            throw new BadRequestException("No property needs an update.");
        }
        if (cluster.getStatus() == ClusterStatus.ERROR) {
            throw new BadRequestException("Updating a cluster in error state is not supported.");
        }

        String name = null;
        if (request.getName() != null && !request.getName().equals(cluster.getName())) {
            checkNameUnique(request.getName());
            name = request.getName();
        }
        if (request.getTimeout() != null) {
            checkTimeout(request.getTimeout());
        }

        String profileId = null;
        if (request.getProfileId() != null) {
            Profile profile = resolveProfileForRequest(request.getProfileId());
            if (!profile.getId().equals(cluster.getProfileId())) {
                String currentType = membershipCoordinator.profileTypeOf(cluster.getProfileId());
                if (!Objects.equals(currentType, profile.getType())) {
                    throw new BadRequestException("Cannot update a cluster to a different profile type, operation aborted.");
                }
                profileId = profile.getId();
            }
        }

        ClusterUpdateInput input = ClusterUpdateInput.builder()
                .name(name)
                .profileId(profileId)
                .metadata(request.getMetadata())
                .timeout(request.getTimeout())
                .build();
        return submit(ActionName.CLUSTER_UPDATE, cluster, input);
    }

    /**
     * Queues deletion of a cluster and all its nodes. Policies must be detached and
     * receivers deleted first.
     */
    public ActionRef deleteCluster(Reference reference) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);

        if (!metadataStore.getBindingsByCluster(cluster.getId()).isEmpty()) {
            throw new ConflictException(String.format(
                    "The cluster (%s) cannot be deleted: there is still policy(s) attached to it.", reference.getValue()));
        }
        boolean hasReceivers = metadataStore.getAllReceivers().stream()
                .anyMatch(receiver -> cluster.getId().equals(receiver.getClusterId()));
        if (hasReceivers) {
            throw new ConflictException(String.format(
                    "The cluster (%s) cannot be deleted: there is still receiver(s) associated with it.",
                    reference.getValue()));
        }
        return submit(ActionName.CLUSTER_DELETE, cluster, null);
    }

    // =================================================================
    // CAPACITY
    // =================================================================

    public ActionRef resize(Reference reference, CapacityRequest request) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        if (request == null || (!request.hasAdjustment() && request.getMinSize() == null && request.getMaxSize() == null)) {
            throw new BadRequestException("Not enough parameters to do resize action.");
        }
        capacityResolver.resolve(cluster, request);
        return submit(ActionName.CLUSTER_RESIZE, cluster, request);
    }

    public ActionRef scaleOut(Reference reference, ScaleRequest request) throws Exception {
        return scale(reference, request, ActionName.CLUSTER_SCALE_OUT);
    }

    public ActionRef scaleIn(Reference reference, ScaleRequest request) throws Exception {
        return scale(reference, request, ActionName.CLUSTER_SCALE_IN);
    }

    private ActionRef scale(Reference reference, ScaleRequest request, ActionName name) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        Integer count = request != null ? request.getCount() : null;

        // without a count the scaling policy, or the default of one node, decides at run time
        if (count != null) {
            if (count <= 0) {
                throw new BadRequestException(String.format("Invalid value '%d' specified for 'count'", count));
            }
            int delta = name == ActionName.CLUSTER_SCALE_OUT ? count : -count;
            capacityResolver.resolve(cluster, CapacityRequest.builder()
                    .adjustmentType(AdjustmentType.CHANGE_IN_CAPACITY.name())
                    .number((double) delta)
                    .strict(true)
                    .build());
        }
        return submit(name, cluster, ScaleInput.builder().count(count).build());
    }

    // =================================================================
    // MEMBERSHIP
    // =================================================================

    public ActionRef addNodes(Reference reference, NodeListRequest request) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        List<String> nodeIds = membershipCoordinator.validateAddNodes(cluster, request != null ? request.getNodes() : null);
        return submit(ActionName.CLUSTER_ADD_NODES, cluster, NodeListInput.builder().nodes(nodeIds).build());
    }

    public ActionRef delNodes(Reference reference, NodeListRequest request) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        List<String> nodeIds = membershipCoordinator.validateDelNodes(cluster, request != null ? request.getNodes() : null);
        NodeListInput input = NodeListInput.builder()
                .nodes(nodeIds)
                .destroyAfterDeletion(request.getDestroyAfterDeletion())
                .build();
        return submit(ActionName.CLUSTER_DEL_NODES, cluster, input);
    }

    public ActionRef replaceNodes(Reference reference, ReplaceNodesRequest request) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        Map<String, String> replacements = membershipCoordinator.validateReplaceNodes(cluster,
                request != null ? request.getNodes() : null);
        return submit(ActionName.CLUSTER_REPLACE_NODES, cluster, ReplaceNodesInput.builder().nodes(replacements).build());
    }

    // =================================================================
    // POLICY BINDINGS
    // =================================================================

    public ActionRef attachPolicy(Reference reference, PolicyBindingRequest request) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        if (request == null || request.getPolicyId() == null || request.getPolicyId().isBlank()) {
            throw new BadRequestException("The 'policy_id' field is required.");
        }
        PolicyBindingInput input = policyBindingManager.validateAttach(cluster,
                Reference.parse(request.getPolicyId()), toBindingInput(request));
        return submit(ActionName.CLUSTER_ATTACH_POLICY, cluster, input);
    }

    public ActionRef detachPolicy(Reference reference, Reference policyReference) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        String policyId = policyBindingManager.validateDetach(cluster, policyReference);
        return submit(ActionName.CLUSTER_DETACH_POLICY, cluster, PolicyBindingInput.builder().policyId(policyId).build());
    }

    public ActionRef updatePolicy(Reference reference, Reference policyReference,
                                  PolicyBindingRequest request) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        PolicyBindingInput input = policyBindingManager.validateUpdate(cluster, policyReference,
                request != null ? toBindingInput(request) : PolicyBindingInput.builder().build());
        return submit(ActionName.CLUSTER_UPDATE_POLICY, cluster, input);
    }

    public List<PolicyBinding> listPolicies(Reference reference) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        return policyBindingManager.getBindings(cluster.getId());
    }

    public PolicyBinding getPolicy(Reference reference, Reference policyReference) throws Exception {
        Cluster cluster = identityResolver.resolveCluster(reference);
        return policyBindingManager.getBinding(cluster, policyReference);
    }

    // =================================================================
    // PRIVATE HELPERS
    // =================================================================

    private ActionRef submit(ActionName name, Cluster cluster, Object payload) throws Exception {
        Map<String, Object> inputs = payload != null ? ActionInputs.toMap(payload) : new HashMap<>();
        Action action = actionEnvelope.submit(name, cluster.getId(), inputs, cluster.getTimeout());
        log.info("[Cluster: {}] {} queued as action {}", cluster.getId(), name, action.getId());
        return ActionRef.of(action.getId());
    }

    private Profile resolveProfileForRequest(String profileRef) {
        try {
            return identityResolver.resolveProfile(Reference.parse(profileRef));
        } catch (ResourceNotFoundException e) {
            throw new BadRequestException(String.format("The specified profile '%s' is not found.", profileRef));
        }
    }

    private void checkNameUnique(String name) throws Exception {
        if (!config.isNameUnique()) {
            return;
        }
        boolean taken = metadataStore.getAllClusters().stream()
                .anyMatch(cluster -> !cluster.isDeleted() && name.equals(cluster.getName()));
        if (taken) {
            throw new ConflictException(String.format("The cluster named (%s) already exists.", name));
        }
    }

    private static void checkTimeout(int timeout) {
        if (timeout < 0) {
            throw new BadRequestException(String.format("Invalid value '%d' specified for 'timeout'", timeout));
        }
    }

    private static PolicyBindingInput toBindingInput(PolicyBindingRequest request) {
        return PolicyBindingInput.builder()
                .priority(request.getPriority())
                .cooldown(request.getCooldown())
                .level(request.getLevel())
                .enabled(request.getEnabled())
                .build();
    }
}
