package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.NodeUpdateInput;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Node;
import io.clusterengine.models.Profile;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Updates node properties; a new profile is pushed to the resource driver first.
 */
@Slf4j
public class NodeUpdateExecutor extends AbstractActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.NODE_UPDATE;
    }

    @Override
    public ActionResult execute(ActionContext context, Action action) throws Exception {
        NodeUpdateInput input = ActionInputs.read(action, NodeUpdateInput.class);
        String nodeId = action.getTarget();

        Node node = updateNode(context, nodeId, n -> {
            n.setStatus(NodeStatus.UPDATING);
            n.setStatusReason("Update in progress");
        });
        checkpoint(context, action);

        String profileId = input.getProfileId();
        if (profileId != null && !profileId.equals(node.getProfileId())) {
            Optional<Profile> profile = context.getMetadataStore().getProfile(profileId);
            String failure = null;
            if (profile.isEmpty()) {
                failure = String.format("The specified profile '%s' is not found.", profileId);
            } else {
                try {
                    context.getResourceDriver().updateNode(node, profile.get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw e;
                } catch (Exception e) {
                    log.warn("Failed to update node {}: {}", nodeId, e.getMessage());
                    failure = String.format("Failed in updating node %s: %s", nodeId, e.getMessage());
                }
            }
            if (failure != null) {
                String reason = failure;
                updateNode(context, nodeId, n -> {
                    n.setStatus(NodeStatus.ERROR);
                    n.setStatusReason(reason);
                });
                return ActionResult.failed(reason);
            }
        }

        updateNode(context, nodeId, n -> {
            if (profileId != null) {
                n.setProfileId(profileId);
            }
            if (input.getName() != null) {
                n.setName(input.getName());
            }
            if (input.getRole() != null) {
                n.setRole(input.getRole());
            }
            if (input.getMetadata() != null) {
                n.setMetadata(input.getMetadata());
            }
            n.setStatus(NodeStatus.ACTIVE);
            n.setStatusReason("Update succeeded");
        });
        return ActionResult.ok("Node updated successfully.");
    }

    @Override
    public void compensate(ActionContext context, Action action) throws Exception {
        updateNode(context, action.getTarget(), n -> {
            if (n.getStatus() == NodeStatus.UPDATING) {
                n.setStatus(NodeStatus.WARNING);
                n.setStatusReason("Update was cancelled.");
            }
        });
    }
}
