package com.github.dominikschlosser.federation.authorization;

import java.util.Objects;

/**
 * Canonical group to provider group name, e.g. {@code ClinicalAdmin -> HC-Clinical-App-Admins}.
 *
 * <p>Only groups listed here are ever asserted to the provider; unknown hub groups are dropped.
 */
public final class GroupMapping {

    private final String providerId;
    private final String groupId;
    private final String targetGroup;

    public GroupMapping(String providerId, String groupId, String targetGroup) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.targetGroup = Objects.requireNonNull(targetGroup, "targetGroup");
    }

    public String getProviderId() {
        return providerId;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getTargetGroup() {
        return targetGroup;
    }
}
