package io.clusterengine.enums;

/**
 * Supported policy types.
 */
public enum PolicyType {
    SCALING("cluster.policy.scaling"),
    DELETION("cluster.policy.deletion"),
    BATCH("cluster.policy.batch");

    private final String value;

    PolicyType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PolicyType fromString(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        for (PolicyType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
