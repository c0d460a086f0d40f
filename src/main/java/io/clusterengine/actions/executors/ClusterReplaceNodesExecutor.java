package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.ReplaceNodesInput;
import io.clusterengine.enums.ActionName;
import io.clusterengine.exceptions.EngineException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;

/**
 * Swaps members for orphan nodes without changing the cluster's capacity.
 */
public class ClusterReplaceNodesExecutor extends ClusterActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_REPLACE_NODES;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        ReplaceNodesInput input = ActionInputs.read(action, ReplaceNodesInput.class);
        try {
            context.getMembershipCoordinator().replaceNodes(cluster.getId(), input.getNodes());
        } catch (EngineException e) {
            return ActionResult.failed(e.getMessage());
        }
        return ActionResult.ok("Completed replacing nodes.");
    }
}
