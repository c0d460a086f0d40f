package io.clusterengine.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of an action. Transitions only move forward; terminal statuses never change.
 */
public enum ActionStatus {
    INIT,
    WAITING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLING,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * Pending actions have not been claimed by a worker yet and can be cancelled directly.
     */
    public boolean isPending() {
        return this == INIT || this == WAITING || this == READY;
    }

    public boolean canTransitionTo(ActionStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<ActionStatus> allowedTransitions() {
        return switch (this) {
            case INIT -> EnumSet.of(WAITING, FAILED, CANCELLED);
            case WAITING -> EnumSet.of(READY, FAILED, CANCELLED);
            case READY -> EnumSet.of(RUNNING, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED, CANCELLING);
            case CANCELLING -> EnumSet.of(CANCELLED, FAILED);
            case SUCCEEDED, FAILED, CANCELLED -> EnumSet.noneOf(ActionStatus.class);
        };
    }

    public static ActionStatus fromString(String value) {
        if (value == null) return null;
        String trimmed = value.trim().toUpperCase();
        for (ActionStatus status : values()) {
            if (status.name().equals(trimmed)) {
                return status;
            }
        }
        return null;
    }
}
