package io.clusterengine.actions;

/**
 * Runs a READY action on the calling thread.
 */
public interface ActionRunner {

    /**
     * Claim the action if it is still READY and execute it to completion.
     *
     * @return false if another worker claimed it first or it is no longer READY
     */
    boolean runIfReady(String actionId);
}
