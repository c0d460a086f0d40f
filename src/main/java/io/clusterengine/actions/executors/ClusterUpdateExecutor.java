package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.ClusterUpdateInput;
import io.clusterengine.actions.inputs.NodeUpdateInput;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.DATA_BATCH_SIZE;

/**
 * Updates cluster properties. A profile change rolls NODE_UPDATE actions over the
 * members in batches; every action of a batch depends on every action of the batch
 * before it. Without a batch policy all nodes form one batch.
 */
@Slf4j
public class ClusterUpdateExecutor extends ClusterActionExecutor {

    @Override
    public ActionName getName() {
        return ActionName.CLUSTER_UPDATE;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        ClusterUpdateInput input = ActionInputs.read(action, ClusterUpdateInput.class);
        String clusterId = cluster.getId();

        updateCluster(context, clusterId, c -> {
            c.setStatus(ClusterStatus.UPDATING);
            c.setStatusReason("Updating cluster.");
            if (input.getName() != null) {
                c.setName(input.getName());
            }
            if (input.getMetadata() != null) {
                c.setMetadata(input.getMetadata());
            }
            if (input.getTimeout() != null) {
                c.setTimeout(input.getTimeout());
            }
        });

        ActionResult result = ActionResult.ok("Cluster properties updated.");
        String newProfile = input.getProfileId();
        if (newProfile != null && !newProfile.equals(cluster.getProfileId())) {
            List<Node> members = context.getMetadataStore().getNodesByCluster(clusterId);
            int batchSize = batchSize(action, members.size());
            result = runChildren(context, action, plan(context, action, members, newProfile, batchSize));
            if (result.isSucceeded()) {
                updateCluster(context, clusterId, c -> c.setProfileId(newProfile));
            }
        }

        return finish(context, clusterId, result, ClusterStatus.ACTIVE, ClusterStatus.WARNING,
                "Cluster update completed.");
    }

    private List<Action> plan(ActionContext context, Action action, List<Node> members, String profileId, int batchSize) {
        NodeUpdateInput nodeInput = NodeUpdateInput.builder().profileId(profileId).build();
        List<Action> children = new ArrayList<>();
        List<String> previousBatch = new ArrayList<>();
        for (int start = 0; start < members.size(); start += batchSize) {
            List<Action> batch = new ArrayList<>();
            for (Node node : members.subList(start, Math.min(start + batchSize, members.size()))) {
                Action child = context.getActionEnvelope().derive(action, ActionName.NODE_UPDATE, node.getId(),
                        ActionInputs.toMap(nodeInput));
                child.setDependsOn(new ArrayList<>(previousBatch));
                batch.add(child);
            }
            children.addAll(batch);
            previousBatch = batch.stream().map(Action::getId).collect(Collectors.toList());
        }
        log.info("[Cluster: {}] Rolling profile update over {} nodes in batches of {}",
                action.getTarget(), members.size(), batchSize);
        return children;
    }

    private static int batchSize(Action action, int total) {
        Object size = action.getData().get(DATA_BATCH_SIZE);
        if (size instanceof Number && ((Number) size).intValue() > 0) {
            return ((Number) size).intValue();
        }
        return Math.max(total, 1);
    }
}
