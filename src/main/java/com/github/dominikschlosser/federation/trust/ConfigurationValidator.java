package com.github.dominikschlosser.federation.trust;

import com.github.dominikschlosser.federation.authorization.AuthorizationHandle;
import com.github.dominikschlosser.federation.authorization.GroupMapping;
import com.github.dominikschlosser.federation.authorization.RoleBinding;
import com.github.dominikschlosser.federation.correlation.CorrelationMode;
import com.github.dominikschlosser.federation.correlation.CorrelationPolicy;
import com.github.dominikschlosser.federation.dynamicgroup.DynamicGroupRule;
import com.github.dominikschlosser.federation.dynamicgroup.MatchingRuleParser;
import com.github.dominikschlosser.federation.mapping.AttributeMappingRule;
import com.github.dominikschlosser.federation.representations.AttributeMappingRepresentation;
import com.github.dominikschlosser.federation.representations.CorrelationPolicyRepresentation;
import com.github.dominikschlosser.federation.representations.DynamicGroupRuleRepresentation;
import com.github.dominikschlosser.federation.representations.FederationConfigRepresentation;
import com.github.dominikschlosser.federation.representations.GroupMappingRepresentation;
import com.github.dominikschlosser.federation.representations.RoleBindingRepresentation;
import com.github.dominikschlosser.federation.representations.TrustedProviderRepresentation;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.keycloak.saml.SignatureAlgorithm;

/**
 * Turns a configuration document into a {@link FederationConfiguration}, or rejects it.
 *
 * <p>All problems are collected before failing so that an operator sees every broken entry of a
 * document at once.
 */
public class ConfigurationValidator {

    private final SigningKeyResolver signingKeyResolver;

    public ConfigurationValidator(SigningKeyResolver signingKeyResolver) {
        this.signingKeyResolver = Objects.requireNonNull(signingKeyResolver, "signingKeyResolver");
    }

    /**
     * @throws ConfigurationException listing every validation error
     */
    public FederationConfiguration validate(FederationConfigRepresentation rep) {
        if (rep == null) {
            throw new ConfigurationException("Configuration document is empty");
        }

        List<String> errors = new ArrayList<>();
        if (isBlank(rep.getVersion())) {
            errors.add("version is required");
        }
        if (isBlank(rep.getIssuer())) {
            errors.add("issuer is required");
        }

        Map<String, TrustedProvider> providers = validateProviders(nullToEmpty(rep.getProviders()), errors);
        Map<String, List<AttributeMappingRule>> mappings =
                validateAttributeMappings(nullToEmpty(rep.getAttributeMappings()), providers, errors);
        Map<String, List<RoleBinding>> bindings =
                validateRoleBindings(nullToEmpty(rep.getRoleBindings()), providers, errors);
        Map<String, CorrelationPolicy> policies =
                validateCorrelationPolicies(nullToEmpty(rep.getCorrelationPolicies()), providers, errors);
        Map<String, List<GroupMapping>> groupMappings =
                validateGroupMappings(nullToEmpty(rep.getGroupMappings()), providers, errors);
        List<DynamicGroupRule> dynamicGroupRules =
                validateDynamicGroupRules(nullToEmpty(rep.getDynamicGroupRules()), errors);

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }

        return new FederationConfiguration(
                rep.getVersion(),
                rep.getIssuer(),
                providers,
                mappings,
                bindings,
                policies,
                groupMappings,
                dynamicGroupRules);
    }

    private Map<String, TrustedProvider> validateProviders(
            List<TrustedProviderRepresentation> reps, List<String> errors) {
        Map<String, TrustedProvider> providers = new LinkedHashMap<>();
        for (TrustedProviderRepresentation rep : reps) {
            String id = rep.getProviderId();
            String prefix = "provider " + id + ": ";
            if (isBlank(id)) {
                errors.add("provider without providerId");
                continue;
            }
            if (providers.containsKey(id)) {
                errors.add(prefix + "duplicate providerId");
                continue;
            }

            int before = errors.size();
            List<String> audiences = splitList(rep.getAudiences());
            if (audiences.isEmpty()) {
                errors.add(prefix + "at least one audience is required");
            }
            for (String audience : audiences) {
                if (!isUri(audience)) {
                    errors.add(prefix + "audience '" + audience + "' is not a valid URI");
                }
            }
            if (!isBlank(rep.getRecipient()) && !isUri(rep.getRecipient().trim())) {
                errors.add(prefix + "recipient '" + rep.getRecipient() + "' is not a valid URI");
            }

            NameIdFormat nameIdFormat = null;
            try {
                nameIdFormat = NameIdFormat.fromConfig(rep.getNameIdFormat());
            } catch (IllegalArgumentException e) {
                errors.add(prefix + e.getMessage());
            }

            if (isBlank(rep.getSigningKeyRef())) {
                errors.add(prefix + "signingKeyRef is required");
            } else if (!signingKeyResolver.isResolvable(rep.getSigningKeyRef())) {
                errors.add(prefix + "signing key " + rep.getSigningKeyRef() + " cannot be resolved");
            }

            SignatureAlgorithm signatureAlgorithm = SignatureAlgorithm.RSA_SHA256;
            if (!isBlank(rep.getSignatureAlgorithm())) {
                try {
                    signatureAlgorithm = SignatureAlgorithm.valueOf(rep.getSignatureAlgorithm().trim());
                } catch (IllegalArgumentException e) {
                    errors.add(prefix + "unknown signatureAlgorithm " + rep.getSignatureAlgorithm());
                }
            }

            boolean requiresCorrelation = Boolean.TRUE.equals(rep.getRequiresCorrelation());
            boolean requiresAuthorization = Boolean.TRUE.equals(rep.getRequiresAuthorization());
            if (requiresCorrelation && requiresAuthorization) {
                errors.add(prefix + "a provider either requires correlation or authorization, not both");
            }
            if (requiresAuthorization && isBlank(rep.getAuthorizationAttributeName())) {
                errors.add(prefix + "authorizationAttributeName is required when requiresAuthorization is set");
            }
            if (!isBlank(rep.getAuthorizationAttributeName())
                    && Objects.equals(rep.getAuthorizationAttributeName(), rep.getGroupsAttributeName())) {
                errors.add(prefix + "authorizationAttributeName and groupsAttributeName must differ");
            }

            Duration lifetime = Duration.ofMinutes(5);
            if (rep.getAssertionLifetimeSeconds() != null) {
                if (rep.getAssertionLifetimeSeconds() <= 0) {
                    errors.add(prefix + "assertionLifetimeSeconds must be positive");
                } else {
                    lifetime = Duration.ofSeconds(rep.getAssertionLifetimeSeconds());
                }
            }

            if (errors.size() > before) {
                continue;
            }

            providers.put(id, TrustedProvider.builder(id)
                    .audiences(audiences)
                    .nameIdFormat(nameIdFormat)
                    .signingKeyRef(rep.getSigningKeyRef())
                    .signatureAlgorithm(signatureAlgorithm)
                    .recipient(blankToNull(rep.getRecipient()))
                    .requiresCorrelation(requiresCorrelation)
                    .requiresAuthorization(requiresAuthorization)
                    .requiredAttributes(new LinkedHashSet<>(splitList(rep.getRequiredAttributes())))
                    .authorizationAttributeName(blankToNull(rep.getAuthorizationAttributeName()))
                    .groupsAttributeName(blankToNull(rep.getGroupsAttributeName()))
                    .assertionLifetime(lifetime)
                    .build());
        }
        return providers;
    }

    private Map<String, List<AttributeMappingRule>> validateAttributeMappings(
            List<AttributeMappingRepresentation> reps, Map<String, TrustedProvider> providers, List<String> errors) {
        Map<String, List<AttributeMappingRule>> rules = new LinkedHashMap<>();
        Set<String> targets = new HashSet<>();
        for (AttributeMappingRepresentation rep : reps) {
            String prefix = "attribute mapping " + rep.getProviderId() + ":" + rep.getTargetAttribute() + ": ";
            TrustedProvider provider = providers.get(rep.getProviderId());
            if (provider == null) {
                errors.add(prefix + "unknown provider");
                continue;
            }
            if (isBlank(rep.getSourceAttribute()) || isBlank(rep.getTargetAttribute())) {
                errors.add(prefix + "sourceAttribute and targetAttribute are required");
                continue;
            }
            if (!targets.add(rep.getProviderId() + "\n" + rep.getTargetAttribute())) {
                errors.add(prefix + "target attribute is written by more than one rule");
                continue;
            }
            if (rep.getTargetAttribute().equals(provider.getAuthorizationAttributeName())
                    || rep.getTargetAttribute().equals(provider.getGroupsAttributeName())) {
                errors.add(prefix + "target attribute is reserved for role or group statements");
                continue;
            }
            rules.computeIfAbsent(rep.getProviderId(), k -> new ArrayList<>())
                    .add(new AttributeMappingRule(
                            rep.getProviderId(),
                            rep.getSourceAttribute(),
                            rep.getTargetAttribute(),
                            blankToNull(rep.getFriendlyName())));
        }
        return rules;
    }

    private Map<String, List<RoleBinding>> validateRoleBindings(
            List<RoleBindingRepresentation> reps, Map<String, TrustedProvider> providers, List<String> errors) {
        Map<String, List<RoleBinding>> bindings = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (RoleBindingRepresentation rep : reps) {
            String prefix = "role binding " + rep.getProviderId() + ":" + rep.getGroupId() + ": ";
            TrustedProvider provider = providers.get(rep.getProviderId());
            if (provider == null) {
                errors.add(prefix + "unknown provider");
                continue;
            }
            if (!provider.isRequiresAuthorization()) {
                errors.add(prefix + "provider does not resolve role bindings");
                continue;
            }
            if (isBlank(rep.getGroupId()) || isBlank(rep.getRoleHandle()) || isBlank(rep.getTrustHandle())) {
                errors.add(prefix + "groupId, roleHandle and trustHandle are required");
                continue;
            }
            if (rep.getRoleHandle().contains(AuthorizationHandle.SEPARATOR)
                    || rep.getTrustHandle().contains(AuthorizationHandle.SEPARATOR)) {
                errors.add(prefix + "role and trust handles must not contain '" + AuthorizationHandle.SEPARATOR + "'");
                continue;
            }
            if (rep.getPrecedence() == null) {
                errors.add(prefix + "precedence is required");
                continue;
            }
            if (!seen.add(rep.getProviderId() + "\n" + rep.getGroupId())) {
                errors.add(prefix + "group is bound more than once");
                continue;
            }
            bindings.computeIfAbsent(rep.getProviderId(), k -> new ArrayList<>())
                    .add(new RoleBinding(
                            rep.getProviderId(),
                            rep.getGroupId(),
                            rep.getRoleHandle(),
                            rep.getTrustHandle(),
                            rep.getPrecedence()));
        }
        for (TrustedProvider provider : providers.values()) {
            if (provider.isRequiresAuthorization() && !bindings.containsKey(provider.getProviderId())) {
                errors.add("provider " + provider.getProviderId()
                        + ": requires authorization but has no role bindings");
            }
        }
        return bindings;
    }

    private Map<String, CorrelationPolicy> validateCorrelationPolicies(
            List<CorrelationPolicyRepresentation> reps, Map<String, TrustedProvider> providers, List<String> errors) {
        Map<String, CorrelationPolicy> policies = new LinkedHashMap<>();
        for (CorrelationPolicyRepresentation rep : reps) {
            String prefix = "correlation policy " + rep.getProviderId() + ": ";
            TrustedProvider provider = providers.get(rep.getProviderId());
            if (provider == null) {
                errors.add(prefix + "unknown provider");
                continue;
            }
            if (!provider.isRequiresCorrelation()) {
                errors.add(prefix + "provider does not require correlation");
                continue;
            }
            if (policies.containsKey(rep.getProviderId())) {
                errors.add(prefix + "duplicate policy");
                continue;
            }
            if (isBlank(rep.getAttributeKey())) {
                errors.add(prefix + "attributeKey is required");
                continue;
            }
            CorrelationMode mode;
            try {
                mode = CorrelationMode.fromConfig(rep.getMode());
            } catch (IllegalArgumentException e) {
                errors.add(prefix + "unknown mode " + rep.getMode());
                continue;
            }
            policies.put(rep.getProviderId(), new CorrelationPolicy(rep.getProviderId(), rep.getAttributeKey(), mode));
        }
        for (TrustedProvider provider : providers.values()) {
            if (provider.isRequiresCorrelation() && !policies.containsKey(provider.getProviderId())) {
                errors.add("provider " + provider.getProviderId() + ": requires correlation but has no policy");
            }
        }
        return policies;
    }

    private Map<String, List<GroupMapping>> validateGroupMappings(
            List<GroupMappingRepresentation> reps, Map<String, TrustedProvider> providers, List<String> errors) {
        Map<String, List<GroupMapping>> mappings = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (GroupMappingRepresentation rep : reps) {
            String prefix = "group mapping " + rep.getProviderId() + ":" + rep.getGroupId() + ": ";
            TrustedProvider provider = providers.get(rep.getProviderId());
            if (provider == null) {
                errors.add(prefix + "unknown provider");
                continue;
            }
            if (provider.getGroupsAttributeName() == null) {
                errors.add(prefix + "provider has no groupsAttributeName");
                continue;
            }
            if (isBlank(rep.getGroupId()) || isBlank(rep.getTargetGroup())) {
                errors.add(prefix + "groupId and targetGroup are required");
                continue;
            }
            if (!seen.add(rep.getProviderId() + "\n" + rep.getGroupId())) {
                errors.add(prefix + "group is mapped more than once");
                continue;
            }
            mappings.computeIfAbsent(rep.getProviderId(), k -> new ArrayList<>())
                    .add(new GroupMapping(rep.getProviderId(), rep.getGroupId(), rep.getTargetGroup()));
        }
        return mappings;
    }

    private List<DynamicGroupRule> validateDynamicGroupRules(
            List<DynamicGroupRuleRepresentation> reps, List<String> errors) {
        List<DynamicGroupRule> rules = new ArrayList<>();
        for (DynamicGroupRuleRepresentation rep : reps) {
            if (isBlank(rep.getGroupId())) {
                errors.add("dynamic group rule without groupId");
                continue;
            }
            try {
                rules.add(new DynamicGroupRule(
                        rep.getGroupId(), MatchingRuleParser.parse(rep.getMatchingRule()), rep.getDescription()));
            } catch (IllegalArgumentException e) {
                errors.add("dynamic group " + rep.getGroupId() + ": " + e.getMessage());
            }
        }
        return rules;
    }

    /** Flattens list entries that are themselves comma-separated, dropping blanks and duplicates. */
    static List<String> splitList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                part = part.trim();
                if (!part.isEmpty()) {
                    result.add(part);
                }
            }
        }
        return new ArrayList<>(result);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static boolean isUri(String value) {
        try {
            new URI(value);
            return true;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
