package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.capacity.CapacityDecision;
import io.clusterengine.capacity.CapacityRequest;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.exceptions.BadRequestException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * Resizes a cluster to the target computed by the capacity resolver against the
 * cluster as it is now, creating or deleting the difference and persisting the new
 * bounds in the same membership write.
 */
@Slf4j
public class ClusterResizeExecutor extends ClusterActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_RESIZE;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        CapacityRequest request = ActionInputs.read(action, CapacityRequest.class);
        String clusterId = cluster.getId();

        CapacityDecision decision;
        try {
            decision = context.getCapacityResolver().resolve(cluster, request);
        } catch (BadRequestException e) {
            return ActionResult.failed(e.getMessage());
        }

        setClusterStatus(context, clusterId, ClusterStatus.RESIZING, "Cluster resize started.");
        Consumer<Cluster> bounds = c -> {
            c.setMinSize(decision.getMinSize());
            c.setMaxSize(decision.getMaxSize());
        };

        int members = cluster.getNodes().size();
        int delta = decision.getTargetCapacity() - members;
        ActionResult result;
        if (delta > 0) {
            result = grow(context, action, clusterId, delta, bounds);
        } else if (delta < 0) {
            result = shrink(context, action, cluster, -delta, bounds);
        } else {
            updateCluster(context, clusterId, c -> {
                bounds.accept(c);
                c.setDesiredCapacity(decision.getTargetCapacity());
            });
            result = ActionResult.ok("Cluster size unchanged.");
        }

        log.info("[Cluster: {}] Resize to {} finished: {}", clusterId, decision.getTargetCapacity(), result.getReason());
        return finish(context, clusterId, result, ClusterStatus.ACTIVE, ClusterStatus.WARNING, "Cluster resize succeeded.");
    }
}
