package io.clusterengine.enums;

/**
 * Lifecycle status of a cluster.
 */
public enum ClusterStatus {
    INIT,
    ACTIVE,
    UPDATING,
    RESIZING,
    ERROR,
    DELETING,
    DELETED,
    WARNING
}
