package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.ArrayList;

/**
 * Destroys every member through derived NODE_DELETE actions, then soft-deletes the
 * cluster. A failed node deletion leaves the cluster in WARNING.
 */
@Slf4j
public class ClusterDeleteExecutor extends ClusterActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_DELETE;
    }

    @Override
    protected boolean checksPolicies() {
        return false;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        String clusterId = cluster.getId();
        setClusterStatus(context, clusterId, ClusterStatus.DELETING, "Deletion in progress.");

        ActionResult result = ActionResult.ok("No nodes to delete.");
        if (!cluster.getNodes().isEmpty()) {
            result = removeMembers(context, action, clusterId, new ArrayList<>(cluster.getNodes()), true, c -> { });
        }
        if (!result.isSucceeded()) {
            setClusterStatus(context, clusterId, ClusterStatus.WARNING, result.getReason());
            return result;
        }

        context.getResourceDriver().deleteCluster(loadCluster(context, clusterId));
        updateCluster(context, clusterId, c -> {
            c.setStatus(ClusterStatus.DELETED);
            c.setStatusReason("Cluster deletion succeeded.");
            c.setDeletedAt(OffsetDateTime.now(context.getClock()));
        });
        log.info("[Cluster: {}] Cluster deleted", clusterId);
        return ActionResult.ok("Cluster deletion succeeded.");
    }
}
