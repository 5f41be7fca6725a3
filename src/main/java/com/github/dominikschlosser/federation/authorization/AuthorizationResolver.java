package com.github.dominikschlosser.federation.authorization;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;
import com.github.dominikschlosser.federation.identity.CanonicalIdentity;
import com.github.dominikschlosser.federation.trust.FederationConfiguration;
import com.github.dominikschlosser.federation.trust.TrustRegistry;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Resolves canonical group memberships to what a provider authorizes on.
 *
 * <p>Role bindings fail closed: no matching binding is an error, never an implicit default role.
 * Among several matches the lowest precedence wins; two matches sharing the lowest precedence are a
 * configuration mistake and are reported as ambiguous rather than picked from.
 */
public class AuthorizationResolver {

    private static final Logger logger = Logger.getLogger(AuthorizationResolver.class);

    private final TrustRegistry trustRegistry;

    public AuthorizationResolver(TrustRegistry trustRegistry) {
        this.trustRegistry = trustRegistry;
    }

    public AuthorizationHandle resolveAuthorization(CanonicalIdentity identity, String providerId) {
        return resolveAuthorization(trustRegistry.snapshot(), identity, providerId);
    }

    /**
     * @throws AuthorizationException {@link RejectionReason#NO_BINDING} or
     *     {@link RejectionReason#AMBIGUOUS_BINDING}
     */
    public AuthorizationHandle resolveAuthorization(
            FederationConfiguration config, CanonicalIdentity identity, String providerId) {
        requireProvider(config, providerId);

        List<RoleBinding> matches = config.getRoleBindings(providerId).stream()
                .filter(binding -> identity.getGroups().contains(binding.getGroupId()))
                .collect(Collectors.toList());

        if (matches.isEmpty()) {
            throw new AuthorizationException(
                    RejectionReason.NO_BINDING,
                    "No role binding of provider " + providerId + " matches groups " + identity.getGroups());
        }

        int best = matches.stream().mapToInt(RoleBinding::getPrecedence).min().getAsInt();
        List<RoleBinding> top = matches.stream()
                .filter(binding -> binding.getPrecedence() == best)
                .collect(Collectors.toList());

        if (top.size() > 1) {
            throw new AuthorizationException(
                    RejectionReason.AMBIGUOUS_BINDING,
                    "Role bindings " + top + " of provider " + providerId + " share precedence " + best);
        }

        RoleBinding chosen = top.get(0);
        if (matches.size() > 1) {
            logger.debugf("trace=%s: %d bindings match for %s, using %s",
                    identity.getTraceId(), matches.size(), providerId, chosen);
        }
        return chosen.getHandle();
    }

    /**
     * Provider group names for the identity's canonical groups. Groups without a mapping are left
     * out.
     */
    public SortedSet<String> resolveProviderGroups(
            FederationConfiguration config, CanonicalIdentity identity, String providerId) {
        requireProvider(config, providerId);
        SortedSet<String> groups = new TreeSet<>();
        for (GroupMapping mapping : config.getGroupMappings(providerId)) {
            if (identity.getGroups().contains(mapping.getGroupId())) {
                groups.add(mapping.getTargetGroup());
            }
        }
        return Collections.unmodifiableSortedSet(groups);
    }

    private static void requireProvider(FederationConfiguration config, String providerId) {
        if (config.getProvider(providerId).isEmpty()) {
            throw new FederationException(RejectionReason.UNKNOWN_PROVIDER, "Unknown provider " + providerId);
        }
    }
}
