package com.github.dominikschlosser.federation.trust;

import com.github.dominikschlosser.federation.authorization.GroupMapping;
import com.github.dominikschlosser.federation.authorization.RoleBinding;
import com.github.dominikschlosser.federation.correlation.CorrelationPolicy;
import com.github.dominikschlosser.federation.dynamicgroup.DynamicGroupRule;
import com.github.dominikschlosser.federation.mapping.AttributeMappingRule;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One complete, validated configuration version.
 *
 * <p>Instances are immutable and only ever replaced as a whole, so a request that picked up a
 * snapshot sees the same providers, rules and bindings until it finishes.
 */
public final class FederationConfiguration {

    private static final FederationConfiguration EMPTY =
            new FederationConfiguration(null, null, Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), List.of());

    private final String version;
    private final String issuer;
    private final Map<String, TrustedProvider> providers;
    private final Map<String, List<AttributeMappingRule>> attributeMappings;
    private final Map<String, List<RoleBinding>> roleBindings;
    private final Map<String, CorrelationPolicy> correlationPolicies;
    private final Map<String, List<GroupMapping>> groupMappings;
    private final List<DynamicGroupRule> dynamicGroupRules;

    FederationConfiguration(
            String version,
            String issuer,
            Map<String, TrustedProvider> providers,
            Map<String, List<AttributeMappingRule>> attributeMappings,
            Map<String, List<RoleBinding>> roleBindings,
            Map<String, CorrelationPolicy> correlationPolicies,
            Map<String, List<GroupMapping>> groupMappings,
            List<DynamicGroupRule> dynamicGroupRules) {
        this.version = version;
        this.issuer = issuer;
        this.providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        this.attributeMappings = copyOfLists(attributeMappings);
        this.roleBindings = copyOfLists(roleBindings);
        this.correlationPolicies = Collections.unmodifiableMap(new LinkedHashMap<>(correlationPolicies));
        this.groupMappings = copyOfLists(groupMappings);
        this.dynamicGroupRules = List.copyOf(dynamicGroupRules);
    }

    /** The snapshot a registry holds before its first successful reload: no providers at all. */
    public static FederationConfiguration empty() {
        return EMPTY;
    }

    public String getVersion() {
        return version;
    }

    /** Entity id of the identity hub, used as the assertion issuer. */
    public String getIssuer() {
        return issuer;
    }

    public Optional<TrustedProvider> getProvider(String providerId) {
        return Optional.ofNullable(providerId == null ? null : providers.get(providerId));
    }

    public Map<String, TrustedProvider> getProviders() {
        return providers;
    }

    public List<AttributeMappingRule> getAttributeMappings(String providerId) {
        return attributeMappings.getOrDefault(providerId, List.of());
    }

    /** Bindings of a provider in configuration order. */
    public List<RoleBinding> getRoleBindings(String providerId) {
        return roleBindings.getOrDefault(providerId, List.of());
    }

    public Optional<CorrelationPolicy> getCorrelationPolicy(String providerId) {
        return Optional.ofNullable(correlationPolicies.get(providerId));
    }

    public List<GroupMapping> getGroupMappings(String providerId) {
        return groupMappings.getOrDefault(providerId, List.of());
    }

    public List<DynamicGroupRule> getDynamicGroupRules() {
        return dynamicGroupRules;
    }

    private static <T> Map<String, List<T>> copyOfLists(Map<String, List<T>> source) {
        Map<String, List<T>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }
}
