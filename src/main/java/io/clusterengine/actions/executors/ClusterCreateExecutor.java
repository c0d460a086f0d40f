package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.ClusterCreateInput;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static io.clusterengine.config.Constants.OUTPUT_NODES_ADDED;
import static io.clusterengine.config.Constants.REASON_CANCELLED;

/**
 * Creates the cluster record under the id handed out at request time and provisions
 * its initial nodes. The cluster ends ACTIVE, or ERROR if any node failed.
 */
@Slf4j
public class ClusterCreateExecutor extends AbstractActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_CREATE;
    }

    @Override
    public ActionResult execute(ActionContext context, Action action) throws Exception {
        ClusterCreateInput input = ActionInputs.read(action, ClusterCreateInput.class);
        String clusterId = action.getTarget();

        Optional<Cluster> existing = context.getMetadataStore().getCluster(clusterId);
        Cluster cluster;
        if (existing.isPresent()) {
            cluster = existing.get();
        } else {
            OffsetDateTime now = OffsetDateTime.now(context.getClock());
            cluster = Cluster.builder()
                    .id(clusterId)
                    .name(input.getName())
                    .profileId(input.getProfileId())
                    .desiredCapacity(0)
                    .minSize(input.getMinSize())
                    .maxSize(input.getMaxSize())
                    .timeout(input.getTimeout())
                    .status(ClusterStatus.INIT)
                    .statusReason("Initializing")
                    .metadata(input.getMetadata() != null ? input.getMetadata() : new HashMap<>())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            context.getMetadataStore().createCluster(cluster);
            log.info("[Cluster: {}] Created cluster record '{}'", clusterId, cluster.getName());
        }

        context.getResourceDriver().createCluster(cluster);
        checkpoint(context, action);

        int count = input.getDesiredCapacity() - cluster.getNodes().size();
        ActionResult result = ActionResult.ok("No nodes to create.");
        if (count > 0) {
            List<Node> reserved = context.getMembershipCoordinator().reserveNodes(clusterId, count,
                    c -> c.setDesiredCapacity(c.getNodes().size()));
            List<String> ids = new ArrayList<>();
            List<Action> children = new ArrayList<>();
            for (Node node : reserved) {
                ids.add(node.getId());
                children.add(context.getActionEnvelope().derive(action, ActionName.NODE_CREATE, node.getId(), null));
            }
            action.getOutputs().put(OUTPUT_NODES_ADDED, ids);
            context.getActionEnvelope().saveProgress(action);
            result = runChildren(context, action, children);
        }

        if (result.isSucceeded()) {
            setClusterStatus(context, clusterId, ClusterStatus.ACTIVE, "Cluster creation succeeded.");
            return ActionResult.ok("Cluster creation succeeded.");
        }
        setClusterStatus(context, clusterId, ClusterStatus.ERROR, result.getReason());
        return result;
    }

    @Override
    public void compensate(ActionContext context, Action action) throws Exception {
        List<String> added = stringList(action.getOutputs(), OUTPUT_NODES_ADDED);
        if (context.getMetadataStore().getCluster(action.getTarget()).isEmpty()) {
            return;
        }
        if (!added.isEmpty()) {
            discardUnprovisioned(context, action.getTarget(), added);
        }
        setClusterStatus(context, action.getTarget(), ClusterStatus.ERROR, REASON_CANCELLED);
    }
}
