package com.github.dominikschlosser.federation.audit;

public enum AuditEventType {
    FEDERATION("federation"),
    CORRELATION("correlation"),
    CONFIGURATION_RELOAD("configuration_reload"),
    DYNAMIC_GROUP_EVALUATION("dynamic_group_evaluation");

    private final String value;

    AuditEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
