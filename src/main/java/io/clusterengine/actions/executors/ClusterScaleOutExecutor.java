package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;

import static io.clusterengine.config.Constants.DATA_CREATION_COUNT;
import static io.clusterengine.models.Cluster.UNBOUNDED;

/**
 * Adds nodes to a cluster. The count comes from a scaling policy decision, the
 * request, or defaults to one.
 */
public class ClusterScaleOutExecutor extends ClusterActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_SCALE_OUT;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        int count = ScaleCounts.resolve(action, DATA_CREATION_COUNT);
        long target = (long) cluster.getNodes().size() + count;
        if (target > context.getConfig().getMaxNodesPerCluster()) {
            return ActionResult.failed(String.format(
                    "The target capacity (%d) is greater than the maximum number of nodes allowed per cluster (%d).",
                    target, context.getConfig().getMaxNodesPerCluster()));
        }
        if (cluster.getMaxSize() != UNBOUNDED && target > cluster.getMaxSize()) {
            return ActionResult.failed(String.format(
                    "The target capacity (%d) is greater than the cluster's max_size (%d).", target, cluster.getMaxSize()));
        }

        setClusterStatus(context, cluster.getId(), ClusterStatus.RESIZING, "Cluster scale-out started.");
        ActionResult result = grow(context, action, cluster.getId(), count, c -> { });
        return finish(context, cluster.getId(), result, ClusterStatus.ACTIVE, ClusterStatus.WARNING,
                "Cluster scaling succeeded.");
    }
}
