package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;

import static io.clusterengine.config.Constants.DATA_DELETION_COUNT;

/**
 * Removes nodes from a cluster, picking victims by the deletion policy's criteria.
 */
public class ClusterScaleInExecutor extends ClusterActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_SCALE_IN;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        int count = ScaleCounts.resolve(action, DATA_DELETION_COUNT);
        int target = cluster.getNodes().size() - count;
        if (target < cluster.getMinSize()) {
            return ActionResult.failed(String.format(
                    "The target capacity (%d) is less than the cluster's min_size (%d).", target, cluster.getMinSize()));
        }

        setClusterStatus(context, cluster.getId(), ClusterStatus.RESIZING, "Cluster scale-in started.");
        ActionResult result = shrink(context, action, cluster, count, c -> { });
        return finish(context, cluster.getId(), result, ClusterStatus.ACTIVE, ClusterStatus.WARNING,
                "Cluster scaling succeeded.");
    }
}
