package io.clusterengine.enums;

/**
 * Verbs an action can carry. Cluster actions are serialized per cluster by the cluster lock.
 */
public enum ActionName {
    CLUSTER_CREATE,
    CLUSTER_UPDATE,
    CLUSTER_DELETE,
    CLUSTER_RESIZE,
    CLUSTER_SCALE_OUT,
    CLUSTER_SCALE_IN,
    CLUSTER_ADD_NODES,
    CLUSTER_DEL_NODES,
    CLUSTER_REPLACE_NODES,
    CLUSTER_ATTACH_POLICY,
    CLUSTER_DETACH_POLICY,
    CLUSTER_UPDATE_POLICY,
    NODE_CREATE,
    NODE_UPDATE,
    NODE_DELETE;

    public boolean isClusterAction() {
        return name().startsWith("CLUSTER_");
    }

    public static ActionName fromString(String value) {
        if (value == null) return null;
        String trimmed = value.trim().toUpperCase();
        for (ActionName name : values()) {
            if (name.name().equals(trimmed)) {
                return name;
            }
        }
        return null;
    }
}
