package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionAbortedException;
import io.clusterengine.actions.ActionCancelledException;
import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionExecutor;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.enums.EntityKind;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.exceptions.ConcurrentUpdateException;
import io.clusterengine.exceptions.ResourceNotFoundException;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.Node;
import io.clusterengine.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Helpers shared by executors: cancellation checkpoints, running derived actions and
 * retrying compare-and-swap updates of clusters and nodes.
 */
@Slf4j
public abstract class AbstractActionExecutor implements ActionExecutor {

    private static final int MAX_UPDATE_ATTEMPTS = 10;

    /**
     * Stop here if the action was asked to cancel or was terminated externally.
     */
    protected void checkpoint(ActionContext context, Action action) throws Exception {
        ActionStatus status = context.getActionEnvelope().get(action.getId()).getStatus();
        if (status == ActionStatus.CANCELLING) {
            throw new ActionCancelledException(action.getId());
        }
        if (status.isTerminal()) {
            throw new ActionAbortedException(action.getId(), status);
        }
    }

    /**
     * Spawn derived actions and wait until all of them are terminal.
     *
     * While waiting, the calling worker runs READY children itself so a pool full of
     * waiting parents still makes progress. A cancel request on the parent cancels every
     * unfinished child before the cancellation propagates.
     *
     * @return ok when every child succeeded, otherwise failed naming the first failure
     */
    protected ActionResult runChildren(ActionContext context, Action parent, List<Action> children) throws Exception {
        if (children.isEmpty()) {
            return ActionResult.ok("No derived actions.");
        }
        context.getActionEnvelope().spawnDerived(parent, children);

        while (true) {
            try {
                checkpoint(context, parent);
            } catch (ActionCancelledException | ActionAbortedException e) {
                List<String> cancelled = context.getActionEnvelope().cancelChildren(parent.getId());
                log.info("Action {} stopped, cancelled derived actions {}", parent.getId(), cancelled);
                throw e;
            }

            List<Action> current = new ArrayList<>();
            boolean progressed = false;
            for (Action child : children) {
                Action latest = context.getActionEnvelope().get(child.getId());
                if (latest.getStatus() == ActionStatus.READY) {
                    progressed |= context.getActionRunner().runIfReady(latest.getId());
                    latest = context.getActionEnvelope().get(child.getId());
                }
                current.add(latest);
            }

            if (current.stream().allMatch(child -> child.getStatus().isTerminal())) {
                return summarize(current);
            }
            if (!progressed) {
                Thread.sleep(context.getConfig().getPollIntervalMillis());
            }
        }
    }

    /**
     * Sleep for {@code seconds} in short slices, stopping early on cancellation.
     */
    protected void pause(ActionContext context, Action action, int seconds) throws Exception {
        long deadline = System.currentTimeMillis() + seconds * 1000L;
        while (System.currentTimeMillis() < deadline) {
            checkpoint(context, action);
            Thread.sleep(Math.min(context.getConfig().getPollIntervalMillis(),
                    Math.max(1L, deadline - System.currentTimeMillis())));
        }
    }

    protected Cluster loadCluster(ActionContext context, String clusterId) throws Exception {
        return context.getMetadataStore().getCluster(clusterId)
                .filter(cluster -> !cluster.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException(
                        IdentityResolver.notFoundMessage(EntityKind.CLUSTER, clusterId)));
    }

    protected Node loadNode(ActionContext context, String nodeId) throws Exception {
        return context.getMetadataStore().getNode(nodeId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        IdentityResolver.notFoundMessage(EntityKind.NODE, nodeId)));
    }

    /**
     * Re-read and update a cluster until the compare-and-swap write succeeds.
     */
    protected Cluster updateCluster(ActionContext context, String clusterId, Consumer<Cluster> changes) throws Exception {
        for (int attempt = 0; ; attempt++) {
            Cluster cluster = loadCluster(context, clusterId);
            changes.accept(cluster);
            cluster.setUpdatedAt(OffsetDateTime.now(context.getClock()));
            try {
                context.getMetadataStore().updateCluster(cluster);
                return cluster;
            } catch (ConcurrentUpdateException e) {
                if (attempt + 1 >= MAX_UPDATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("[Cluster: {}] Concurrent update, retrying", clusterId);
            }
        }
    }

    /**
     * Re-read and update a node until the compare-and-swap write succeeds.
     */
    protected Node updateNode(ActionContext context, String nodeId, Consumer<Node> changes) throws Exception {
        for (int attempt = 0; ; attempt++) {
            Node node = loadNode(context, nodeId);
            changes.accept(node);
            node.setUpdatedAt(OffsetDateTime.now(context.getClock()));
            try {
                context.getMetadataStore().updateNode(node);
                return node;
            } catch (ConcurrentUpdateException e) {
                if (attempt + 1 >= MAX_UPDATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Node {} concurrent update, retrying", nodeId);
            }
        }
    }

    protected void setClusterStatus(ActionContext context, String clusterId,
                                    ClusterStatus status, String reason) throws Exception {
        updateCluster(context, clusterId, cluster -> {
            cluster.setStatus(status);
            cluster.setStatusReason(reason);
        });
        log.info("[Cluster: {}] Status {}: {}", clusterId, status, reason);
    }

    /**
     * Remove member nodes that were reserved but never provisioned, i.e. still in INIT.
     */
    protected List<String> discardUnprovisioned(ActionContext context, String clusterId, List<String> nodeIds) throws Exception {
        List<String> discarded = new ArrayList<>();
        for (String nodeId : nodeIds) {
            Optional<Node> node = context.getMetadataStore().getNode(nodeId);
            if (node.isPresent() && node.get().getStatus() == NodeStatus.INIT && clusterId.equals(node.get().getClusterId())) {
                discarded.add(nodeId);
            }
        }
        if (discarded.isEmpty()) {
            return discarded;
        }
        context.getMembershipCoordinator().releaseNodes(clusterId, discarded,
                cluster -> cluster.setDesiredCapacity(cluster.getNodes().size()));
        for (String nodeId : discarded) {
            context.getMetadataStore().deleteNode(nodeId);
        }
        log.info("[Cluster: {}] Discarded unprovisioned nodes {}", clusterId, discarded);
        return discarded;
    }

    protected static List<String> stringList(Map<String, Object> map, String key) {
        return JsonUtils.toStringList(map.get(key));
    }

    private static ActionResult summarize(List<Action> children) {
        for (Action child : children) {
            if (child.getStatus() != ActionStatus.SUCCEEDED) {
                return ActionResult.failed(String.format("Derived action %s (%s) ended in %s: %s",
                        child.getName(), child.getId(), child.getStatus(), child.getStatusReason()));
            }
        }
        return ActionResult.ok(String.format("All %d derived actions succeeded.", children.size()));
    }
}
