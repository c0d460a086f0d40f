package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.exceptions.EngineException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Destroys a node's resource and deletes its record.
 *
 * A derived NODE_DELETE acts on a node its parent already released. A user request on
 * a member node first takes it out of its cluster, subject to the cluster's min_size.
 */
@Slf4j
public class NodeDeleteExecutor extends AbstractActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.NODE_DELETE;
    }

    @Override
    public ActionResult execute(ActionContext context, Action action) throws Exception {
        String nodeId = action.getTarget();
        Optional<Node> existing = context.getMetadataStore().getNode(nodeId);
        if (existing.isEmpty()) {
            return ActionResult.ok("Node already deleted.");
        }

        if (!action.isDerived() && !existing.get().isOrphan()) {
            try {
                context.getMembershipCoordinator().leaveCluster(nodeId);
            } catch (EngineException e) {
                return ActionResult.failed(e.getMessage());
            }
        }

        Node node = updateNode(context, nodeId, n -> {
            n.setStatus(NodeStatus.DELETING);
            n.setStatusReason("Deletion in progress");
        });
        checkpoint(context, action);

        try {
            context.getResourceDriver().deleteNode(node);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            String reason = String.format("Failed in deleting node %s: %s", nodeId, e.getMessage());
            log.warn(reason);
            updateNode(context, nodeId, n -> {
                n.setStatus(NodeStatus.ERROR);
                n.setStatusReason(reason);
            });
            return ActionResult.failed(reason);
        }

        context.getMetadataStore().deleteNode(nodeId);
        log.info("Node {} deleted", nodeId);
        return ActionResult.ok("Node deleted successfully.");
    }
}
