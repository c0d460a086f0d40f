package io.clusterengine.actions;

import io.clusterengine.enums.ActionName;
import io.clusterengine.models.Action;

/**
 * Execution logic of one action name.
 */
public interface ActionExecutor {

    /**
     * Get the action name this executor handles.
     */
    ActionName getName();

    /**
     * Execute the action on the calling thread.
     *
     * @param context shared services
     * @param action the claimed action, in RUNNING
     * @return SUCCEEDED or FAILED with a reason
     * @throws ActionCancelledException when a checkpoint observed a cancel request
     * @throws ActionAbortedException when the action was terminated externally
     */
    ActionResult execute(ActionContext context, Action action) throws Exception;

    /**
     * Best-effort cleanup after the action was cancelled or aborted.
     */
    default void compensate(ActionContext context, Action action) throws Exception {
    }
}
