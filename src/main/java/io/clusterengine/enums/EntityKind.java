package io.clusterengine.enums;

/**
 * Kinds of entities that can be referenced by UUID or name.
 */
public enum EntityKind {
    CLUSTER("cluster"),
    NODE("node"),
    PROFILE("profile"),
    POLICY("policy"),
    RECEIVER("receiver"),
    ACTION("action");

    private final String value;

    EntityKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
