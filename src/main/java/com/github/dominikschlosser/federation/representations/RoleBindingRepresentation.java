package com.github.dominikschlosser.federation.representations;

/**
 * Binds a canonical group to a role and trust handle pair of a role-federating provider. Lower
 * {@code precedence} wins when several bindings match one identity.
 */
public class RoleBindingRepresentation {

    private String providerId;
    private String groupId;
    private String roleHandle;
    private String trustHandle;
    private Integer precedence;

    public String getProviderId() {
        return providerId;
    }

    public void setProviderId(String providerId) {
        this.providerId = providerId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getRoleHandle() {
        return roleHandle;
    }

    public void setRoleHandle(String roleHandle) {
        this.roleHandle = roleHandle;
    }

    public String getTrustHandle() {
        return trustHandle;
    }

    public void setTrustHandle(String trustHandle) {
        this.trustHandle = trustHandle;
    }

    public Integer getPrecedence() {
        return precedence;
    }

    public void setPrecedence(Integer precedence) {
        this.precedence = precedence;
    }
}
