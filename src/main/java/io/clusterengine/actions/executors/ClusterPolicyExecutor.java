package io.clusterengine.actions.executors;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionResult;
import io.clusterengine.actions.inputs.ActionInputs;
import io.clusterengine.actions.inputs.PolicyBindingInput;
import io.clusterengine.enums.ActionName;
import io.clusterengine.exceptions.EngineException;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.policies.PolicyBindingManager;

/**
 * Attaches, detaches or updates a policy binding of the cluster.
 */
public class ClusterPolicyExecutor extends ClusterActionExecutor {

    private final ActionName name;

    public ClusterPolicyExecutor(ActionName name) {
        this.name = name;
    }

    @Override
    public ActionName getName() {
        return name;
    }

    @Override
    protected boolean checksPolicies() {
        return false;
    }

    @Override
    protected ActionResult doExecute(ActionContext context, Action action, Cluster cluster) throws Exception {
        PolicyBindingInput input = ActionInputs.read(action, PolicyBindingInput.class);
        PolicyBindingManager bindings = context.getPolicyBindingManager();
        try {
            switch (name) {
                case CLUSTER_ATTACH_POLICY:
                    bindings.attach(cluster.getId(), input);
                    return ActionResult.ok("Policy attached.");
                case CLUSTER_DETACH_POLICY:
                    bindings.detach(cluster.getId(), input.getPolicyId());
                    return ActionResult.ok("Policy detached.");
                case CLUSTER_UPDATE_POLICY:
                    bindings.update(cluster.getId(), input);
                    return ActionResult.ok("Policy updated.");
                default:
                    throw new IllegalStateException("Unsupported policy action " + name);
            }
        } catch (EngineException e) {
            return ActionResult.failed(e.getMessage());
        }
    }

    @Override
    public void compensate(ActionContext context, Action action) {
        // nothing was reserved
    }
}
