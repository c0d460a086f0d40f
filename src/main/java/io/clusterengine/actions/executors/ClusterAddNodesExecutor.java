package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.NodeListInput;
import io.clusterengine.enums.ActionName;
import io.clusterengine.exceptions.EngineException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;

import java.util.HashMap;
import java.util.Map;

import static io.clusterengine.config.Constants.OUTPUT_NODES_ADDED;

/**
 * Admits existing orphan nodes into the cluster.
 */
public class ClusterAddNodesExecutor extends ClusterActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_ADD_NODES;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        NodeListInput input = ActionInputs.read(action, NodeListInput.class);
        try {
            context.getMembershipCoordinator().addNodes(cluster.getId(), input.getNodes());
        } catch (EngineException e) {
            return ActionResult.failed(e.getMessage());
        }
        Map<String, Object> outputs = new HashMap<>();
        outputs.put(OUTPUT_NODES_ADDED, input.getNodes());
        return ActionResult.ok("Completed adding nodes.", outputs);
    }
}
