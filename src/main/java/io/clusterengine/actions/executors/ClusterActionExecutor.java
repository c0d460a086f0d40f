package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.enums.ActionName;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.enums.DeletionCriteria;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.policies.enforcement.PolicyCheckResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static io.clusterengine.config.Constants.DATA_DELETION_CRITERIA;
import static io.clusterengine.config.Constants.DATA_DESTROY_AFTER_DELETION;
import static io.clusterengine.config.Constants.DATA_GRACE_PERIOD;
import static io.clusterengine.config.Constants.OUTPUT_NODES_ADDED;
import static io.clusterengine.config.Constants.OUTPUT_NODES_REMOVED;
import static io.clusterengine.config.Constants.REASON_CANCELLED;

/**
 * Base of actions targeting an existing cluster.
 *
 * Runs the bound policies before {@link #doExecute}, persists their decisions with the
 * action, and starts the cooldown of the checked bindings after a successful run.
 */
@Slf4j
public abstract class ClusterActionExecutor extends AbstractActionExecutor {

    @Override
    public ActionResult execute(ActionContext context, Action action) throws Exception {
        Cluster cluster = loadCluster(context, action.getTarget());

        if (checksPolicies()) {
            int members = context.getMetadataStore().getNodesByCluster(cluster.getId()).size();
            PolicyCheckResult check = context.getPolicyEnforcement().checkBefore(cluster, members, action);
            context.getActionEnvelope().saveProgress(action);
            if (!check.isPassed()) {
                log.info("[Cluster: {}] Action {} rejected by policy: {}", cluster.getId(), action.getId(), check.getReason());
                return ActionResult.failed(check.getReason());
            }
        }

        checkpoint(context, action);
        ActionResult result = doExecute(context, action, cluster);

        if (result.isSucceeded() && checksPolicies()) {
            context.getPolicyEnforcement().recordAfter(cluster.getId(), action);
        }
        return result;
    }

    /**
     * Cluster-level work of the action, run after the policy checks passed.
     */
    protected abstract ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception;

    protected boolean checksPolicies() {
        return true;
    }

    /**
     * Drop nodes this action reserved but never provisioned and flag the cluster.
     */
    @Override
    public void compensate(ActionContext context, Action action) throws Exception {
        List<String> added = stringList(action.getOutputs(), OUTPUT_NODES_ADDED);
        if (!added.isEmpty()) {
            discardUnprovisioned(context, action.getTarget(), added);
        }
        if (context.getMetadataStore().getCluster(action.getTarget()).filter(c -> !c.isDeleted()).isPresent()) {
            setClusterStatus(context, action.getTarget(), ClusterStatus.WARNING, REASON_CANCELLED);
        }
    }

    /**
     * Reserve {@code count} member nodes, applying {@code changes} to the cluster in the
     * same write, and provision them through derived NODE_CREATE actions.
     */
    protected ActionResult grow(ActionContext context, Action action, String clusterId, int count,
                                Consumer<Cluster> changes) throws Exception {
        List<Node> reserved = context.getMembershipCoordinator().reserveNodes(clusterId, count, cluster -> {
            changes.accept(cluster);
            cluster.setDesiredCapacity(cluster.getNodes().size());
        });

        List<String> ids = new ArrayList<>();
        List<Action> children = new ArrayList<>();
        for (Node node : reserved) {
            ids.add(node.getId());
            children.add(context.getActionEnvelope().derive(action, ActionName.NODE_CREATE, node.getId(), null));
        }
        action.getOutputs().put(OUTPUT_NODES_ADDED, ids);
        context.getActionEnvelope().saveProgress(action);

        return runChildren(context, action, children);
    }

    /**
     * Pick {@code count} victims by the recorded deletion criteria, release them from the
     * cluster in one write with {@code changes}, and destroy them unless the deletion
     * policy says otherwise.
     */
    protected ActionResult shrink(ActionContext context, Action action, Cluster cluster, int count,
                                  Consumer<Cluster> changes) throws Exception {
        List<Node> members = context.getMetadataStore().getNodesByCluster(cluster.getId());
        DeletionCriteria criteria = DeletionCriteria.fromString((String) action.getData().get(DATA_DELETION_CRITERIA));
        List<String> victims = context.getVictimSelector().select(members, count, criteria, cluster.getProfileId());
        return removeMembers(context, action, cluster.getId(), victims, destroyAfterDeletion(action, true), changes);
    }

    /**
     * Release the given members and optionally destroy them through derived NODE_DELETE actions.
     */
    protected ActionResult removeMembers(ActionContext context, Action action, String clusterId, List<String> victims,
                                         boolean destroy, Consumer<Cluster> changes) throws Exception {
        Object grace = action.getData().get(DATA_GRACE_PERIOD);
        if (grace instanceof Number && ((Number) grace).intValue() > 0) {
            pause(context, action, ((Number) grace).intValue());
        }

        context.getMembershipCoordinator().releaseNodes(clusterId, victims, cluster -> {
            changes.accept(cluster);
            cluster.setDesiredCapacity(cluster.getNodes().size());
        });
        action.getOutputs().put(OUTPUT_NODES_REMOVED, victims);
        context.getActionEnvelope().saveProgress(action);

        if (!destroy) {
            return ActionResult.ok("Nodes released.");
        }
        List<Action> children = new ArrayList<>();
        for (String nodeId : victims) {
            children.add(context.getActionEnvelope().derive(action, ActionName.NODE_DELETE, nodeId, null));
        }
        return runChildren(context, action, children);
    }

    protected static boolean destroyAfterDeletion(Action action, boolean fallback) {
        Object destroy = action.getData().get(DATA_DESTROY_AFTER_DELETION);
        return destroy instanceof Boolean ? (Boolean) destroy : fallback;
    }

    /**
     * Set the final cluster status from the result: {@code onSuccess} or {@code onFailure}.
     */
    protected ActionResult finish(ActionContext context, String clusterId, ActionResult result,
                                  ClusterStatus onSuccess, ClusterStatus onFailure, String successReason) throws Exception {
        if (result.isSucceeded()) {
            setClusterStatus(context, clusterId, onSuccess, successReason);
            return ActionResult.ok(successReason, result.getOutputs());
        }
        setClusterStatus(context, clusterId, onFailure, result.getReason());
        return result;
    }
}
