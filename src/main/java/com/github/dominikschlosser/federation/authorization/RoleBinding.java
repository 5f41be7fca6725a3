package com.github.dominikschlosser.federation.authorization;

import java.util.Objects;

/** (provider, canonical group) to (role handle, trust handle), ranked by precedence. */
public final class RoleBinding {

    private final String providerId;
    private final String groupId;
    private final AuthorizationHandle handle;
    private final int precedence;

    public RoleBinding(String providerId, String groupId, String roleHandle, String trustHandle, int precedence) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        this.handle = new AuthorizationHandle(roleHandle, trustHandle);
        this.precedence = precedence;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getGroupId() {
        return groupId;
    }

    public AuthorizationHandle getHandle() {
        return handle;
    }

    public int getPrecedence() {
        return precedence;
    }

    @Override
    public String toString() {
        return providerId + ":" + groupId + "->" + handle.encode() + "@" + precedence;
    }
}
