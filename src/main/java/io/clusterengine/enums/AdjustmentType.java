package io.clusterengine.enums;

/**
 * How a size adjustment number is interpreted.
 *
 * EXACT_CAPACITY: absolute target, CHANGE_IN_CAPACITY: signed delta, CHANGE_IN_PERCENTAGE: percent of current desired
 */
public enum AdjustmentType {
    EXACT_CAPACITY,
    CHANGE_IN_CAPACITY,
    CHANGE_IN_PERCENTAGE;

    public static AdjustmentType fromString(String value) {
        if (value == null) return null;
        String trimmed = value.trim().toUpperCase();
        for (AdjustmentType type : values()) {
            if (type.name().equals(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
