package io.clusterengine.enums;

/**
 * Lifecycle status of a node.
 */
public enum NodeStatus {
    INIT,
    CREATING,
    ACTIVE,
    UPDATING,
    DELETING,
    ERROR,
    WARNING
}
