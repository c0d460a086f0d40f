package io.clusterengine.actions;

import io.clusterengine.enums.ActionStatus;

/**
 * Thrown at a checkpoint when the running action was already terminated by someone
 * else, e.g. forced to FAILED on timeout.
 */
public class ActionAbortedException extends Exception {

    public ActionAbortedException(String actionId, ActionStatus status) {
        super("Action " + actionId + " was terminated externally with status " + status);
    }
}
