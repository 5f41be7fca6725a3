package com.github.dominikschlosser.federation.representations;

import java.util.List;

/**
 * Root of a versioned federation configuration document.
 *
 * <pre>
 * {
 *   "version": "2026-10-01",
 *   "issuer": "https://hub.example.com/saml",
 *   "providers": [...],
 *   "attributeMappings": [...],
 *   "roleBindings": [...],
 *   "correlationPolicies": [...],
 *   "groupMappings": [...],
 *   "dynamicGroupRules": [...]
 * }
 * </pre>
 */
public class FederationConfigRepresentation {

    private String version;
    private String issuer;
    private List<TrustedProviderRepresentation> providers;
    private List<AttributeMappingRepresentation> attributeMappings;
    private List<RoleBindingRepresentation> roleBindings;
    private List<CorrelationPolicyRepresentation> correlationPolicies;
    private List<GroupMappingRepresentation> groupMappings;
    private List<DynamicGroupRuleRepresentation> dynamicGroupRules;

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public List<TrustedProviderRepresentation> getProviders() {
        return providers;
    }

    public void setProviders(List<TrustedProviderRepresentation> providers) {
        this.providers = providers;
    }

    public List<AttributeMappingRepresentation> getAttributeMappings() {
        return attributeMappings;
    }

    public void setAttributeMappings(List<AttributeMappingRepresentation> attributeMappings) {
        this.attributeMappings = attributeMappings;
    }

    public List<RoleBindingRepresentation> getRoleBindings() {
        return roleBindings;
    }

    public void setRoleBindings(List<RoleBindingRepresentation> roleBindings) {
        this.roleBindings = roleBindings;
    }

    public List<CorrelationPolicyRepresentation> getCorrelationPolicies() {
        return correlationPolicies;
    }

    public void setCorrelationPolicies(List<CorrelationPolicyRepresentation> correlationPolicies) {
        this.correlationPolicies = correlationPolicies;
    }

    public List<GroupMappingRepresentation> getGroupMappings() {
        return groupMappings;
    }

    public void setGroupMappings(List<GroupMappingRepresentation> groupMappings) {
        this.groupMappings = groupMappings;
    }

    public List<DynamicGroupRuleRepresentation> getDynamicGroupRules() {
        return dynamicGroupRules;
    }

    public void setDynamicGroupRules(List<DynamicGroupRuleRepresentation> dynamicGroupRules) {
        this.dynamicGroupRules = dynamicGroupRules;
    }
}
