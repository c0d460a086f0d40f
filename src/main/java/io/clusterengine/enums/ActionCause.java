package io.clusterengine.enums;

/**
 * Why an action exists: requested by a caller, or spawned by another action.
 */
public enum ActionCause {
    USER,
    DERIVED
}
