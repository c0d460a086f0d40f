package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.NodeListInput;
import io.clusterengine.enums.ActionName;
import io.clusterengine.exceptions.EngineException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;

/**
 * Releases members from the cluster. Released nodes are destroyed when the deletion
 * policy or the request asks for it, otherwise they stay as orphans.
 */
public class ClusterDelNodesExecutor extends ClusterActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_DEL_NODES;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        NodeListInput input = ActionInputs.read(action, NodeListInput.class);
        try {
            context.getMembershipCoordinator().validateDelNodes(cluster, input.getNodes());
        } catch (EngineException e) {
            return ActionResult.failed(e.getMessage());
        }

        boolean requested = input.getDestroyAfterDeletion() != null && input.getDestroyAfterDeletion();
        boolean destroy = destroyAfterDeletion(action, requested);
        ActionResult result = removeMembers(context, action, cluster.getId(), input.getNodes(), destroy, c -> { });
        if (!result.isSucceeded()) {
            return result;
        }
        return ActionResult.ok("Completed deleting nodes.");
    }
}
