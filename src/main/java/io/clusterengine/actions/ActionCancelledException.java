package io.clusterengine.actions;

/**
 * Thrown at a checkpoint when the running action was asked to cancel.
 */
public class ActionCancelledException extends Exception {

    public ActionCancelledException(String actionId) {
        super("Action " + actionId + " was cancelled");
    }
}
