package io.clusterengine.enums;

/**
 * Victim selection criteria used when a cluster shrinks.
 */
public enum DeletionCriteria {
    OLDEST_FIRST,
    OLDEST_PROFILE_FIRST,
    YOUNGEST_FIRST,
    RANDOM;

    public static DeletionCriteria fromString(String value) {
        if (value == null) return null;
        String trimmed = value.trim().toUpperCase();
        for (DeletionCriteria criteria : values()) {
            if (criteria.name().equals(trimmed)) {
                return criteria;
            }
        }
        return null;
    }
}
