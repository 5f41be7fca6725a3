package com.github.dominikschlosser.federation.mapping;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;
import com.github.dominikschlosser.federation.identity.CanonicalIdentity;
import com.github.dominikschlosser.federation.trust.FederationConfiguration;
import com.github.dominikschlosser.federation.trust.TrustRegistry;
import com.github.dominikschlosser.federation.trust.TrustedProvider;
import org.jboss.logging.Logger;

/**
 * Translates a canonical identity into the attribute set of one provider.
 *
 * <p>Pure with respect to its inputs: the same identity and the same rule set give an equal
 * {@link AttributeSet}. A rule whose source attribute is absent is skipped unless the provider
 * lists that source attribute as required.
 */
public class AttributeMappingEngine {

    private static final Logger logger = Logger.getLogger(AttributeMappingEngine.class);

    private final TrustRegistry trustRegistry;

    public AttributeMappingEngine(TrustRegistry trustRegistry) {
        this.trustRegistry = trustRegistry;
    }

    public AttributeSet mapAttributes(CanonicalIdentity identity, String providerId) {
        return mapAttributes(trustRegistry.snapshot(), identity, providerId);
    }

    /**
     * @throws MappingException if a required source attribute is missing
     * @throws FederationException with {@link RejectionReason#UNKNOWN_PROVIDER} if the provider is not
     *     configured in {@code config}
     */
    public AttributeSet mapAttributes(FederationConfiguration config, CanonicalIdentity identity, String providerId) {
        TrustedProvider provider = config.getProvider(providerId)
                .orElseThrow(() -> new FederationException(
                        RejectionReason.UNKNOWN_PROVIDER, "Unknown provider " + providerId));

        for (String required : provider.getRequiredAttributes()) {
            String value = identity.getAttribute(required);
            if (value == null || value.isEmpty()) {
                throw new MappingException(
                        RejectionReason.REQUIRED_ATTRIBUTE_MISSING,
                        "Provider " + providerId + " requires attribute '" + required + "'");
            }
        }

        AttributeSet.Builder attributes = AttributeSet.builder();
        for (AttributeMappingRule rule : config.getAttributeMappings(providerId)) {
            String value = identity.getAttribute(rule.getSourceAttribute());
            if (value == null) {
                logger.debugf("trace=%s: skipping %s, source attribute absent", identity.getTraceId(), rule);
                continue;
            }
            attributes.add(rule.getTargetAttribute(), value, rule.getFriendlyName());
        }
        return attributes.build();
    }
}
