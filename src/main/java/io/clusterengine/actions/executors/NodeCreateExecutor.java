package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.NodeCreateInput;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.exceptions.EngineException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Node;
import io.clusterengine.models.Profile;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Optional;

/**
 * Provisions a node.
 *
 * A derived NODE_CREATE provisions a member reserved by its parent. A user request
 * first creates the node record under the id handed out at request time, provisions
 * it, and then joins the requested cluster.
 */
@Slf4j
public class NodeCreateExecutor extends AbstractActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.NODE_CREATE;
    }

    @Override
    public ActionResult execute(ActionContext context, Action action) throws Exception {
        String nodeId = action.getTarget();
        NodeCreateInput input = action.isDerived() ? null : ActionInputs.read(action, NodeCreateInput.class);

        if (input != null && context.getMetadataStore().getNode(nodeId).isEmpty()) {
            OffsetDateTime now = OffsetDateTime.now(context.getClock());
            context.getMetadataStore().createNode(Node.builder()
                    .id(nodeId)
                    .name(input.getName())
                    .profileId(input.getProfileId())
                    .role(input.getRole())
                    .status(NodeStatus.INIT)
                    .metadata(input.getMetadata() != null ? input.getMetadata() : new HashMap<>())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }

        Node node = updateNode(context, nodeId, n -> {
            n.setStatus(NodeStatus.CREATING);
            n.setStatusReason("Creation in progress");
        });
        checkpoint(context, action);

        Optional<Profile> profile = context.getMetadataStore().getProfile(node.getProfileId());
        if (profile.isEmpty()) {
            return failNode(context, nodeId, String.format("The specified profile '%s' is not found.", node.getProfileId()));
        }

        String physicalId;
        try {
            physicalId = context.getResourceDriver().createNode(node, profile.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            log.warn("Failed to create node {}: {}", nodeId, e.getMessage());
            return failNode(context, nodeId, String.format("Failed in creating node %s: %s", nodeId, e.getMessage()));
        }

        updateNode(context, nodeId, n -> {
            n.setPhysicalId(physicalId);
            n.setStatus(NodeStatus.ACTIVE);
            n.setStatusReason("Creation succeeded");
        });

        if (input != null && input.getClusterId() != null) {
            try {
                context.getMembershipCoordinator().joinCluster(input.getClusterId(), nodeId);
            } catch (EngineException e) {
                return ActionResult.failed(String.format("Node %s created but failed to join cluster %s: %s",
                        nodeId, input.getClusterId(), e.getMessage()));
            }
        }
        return ActionResult.ok("Node created successfully.");
    }

    @Override
    public void compensate(ActionContext context, Action action) throws Exception {
        Optional<Node> node = context.getMetadataStore().getNode(action.getTarget());
        if (node.isPresent() && node.get().getPhysicalId() == null && node.get().isOrphan()) {
            context.getMetadataStore().deleteNode(action.getTarget());
            log.info("Removed unprovisioned node {}", action.getTarget());
        }
    }

    private ActionResult failNode(ActionContext context, String nodeId, String reason) throws Exception {
        try {
            updateNode(context, nodeId, n -> {
                n.setStatus(NodeStatus.ERROR);
                n.setStatusReason(reason);
            });
        } catch (ResourceNotFoundException e) {
            log.debug("Node {} vanished before its failure could be recorded", nodeId);
        }
        return ActionResult.failed(reason);
    }
}
