package io.clusterengine.metrics;

/**
 * Constants for metrics names and tags used in the engine.
 */
public class MetricsConstants {
    public final static String ACTIONS_FINISHED_METRIC_NAME = "actions_finished";
    public final static String ACTION_EXECUTION_TIME_METRIC_NAME = "action_execution_time";
    public final static String CLUSTER_LOCKS_HELD_METRIC_NAME = "cluster_locks_held";
    public final static String ACTION_NAME_TAG = "action";
    public final static String ACTION_STATUS_TAG = "status";

    private MetricsConstants() {}
}
