package com.github.dominikschlosser.federation.trust;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.keycloak.saml.SignatureAlgorithm;

/**
 * Validated metadata of one relying party.
 *
 * <p>The provider may accept several audience strings, but assertions are always issued against the
 * first one, the canonical audience.
 */
public final class TrustedProvider {

    private final String providerId;
    private final List<String> audiences;
    private final NameIdFormat nameIdFormat;
    private final String signingKeyRef;
    private final SignatureAlgorithm signatureAlgorithm;
    private final String recipient;
    private final boolean requiresCorrelation;
    private final boolean requiresAuthorization;
    private final Set<String> requiredAttributes;
    private final String authorizationAttributeName;
    private final String groupsAttributeName;
    private final Duration assertionLifetime;

    private TrustedProvider(Builder builder) {
        this.providerId = builder.providerId;
        this.audiences = List.copyOf(builder.audiences);
        this.nameIdFormat = builder.nameIdFormat;
        this.signingKeyRef = builder.signingKeyRef;
        this.signatureAlgorithm = builder.signatureAlgorithm;
        this.recipient = builder.recipient;
        this.requiresCorrelation = builder.requiresCorrelation;
        this.requiresAuthorization = builder.requiresAuthorization;
        this.requiredAttributes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredAttributes));
        this.authorizationAttributeName = builder.authorizationAttributeName;
        this.groupsAttributeName = builder.groupsAttributeName;
        this.assertionLifetime = builder.assertionLifetime;
    }

    public static Builder builder(String providerId) {
        return new Builder(providerId);
    }

    public String getProviderId() {
        return providerId;
    }

    /** Every audience the relying party accepts, canonical one first. */
    public List<String> getAudiences() {
        return audiences;
    }

    public String getCanonicalAudience() {
        return audiences.get(0);
    }

    public boolean acceptsAudience(String audience) {
        return audiences.contains(audience);
    }

    public NameIdFormat getNameIdFormat() {
        return nameIdFormat;
    }

    public String getSigningKeyRef() {
        return signingKeyRef;
    }

    public SignatureAlgorithm getSignatureAlgorithm() {
        return signatureAlgorithm;
    }

    /** SubjectConfirmation recipient; the canonical audience unless configured otherwise. */
    public String getRecipient() {
        return recipient != null ? recipient : getCanonicalAudience();
    }

    public boolean isRequiresCorrelation() {
        return requiresCorrelation;
    }

    public boolean isRequiresAuthorization() {
        return requiresAuthorization;
    }

    public Set<String> getRequiredAttributes() {
        return requiredAttributes;
    }

    public String getAuthorizationAttributeName() {
        return authorizationAttributeName;
    }

    public String getGroupsAttributeName() {
        return groupsAttributeName;
    }

    public Duration getAssertionLifetime() {
        return assertionLifetime;
    }

    @Override
    public String toString() {
        return "TrustedProvider{" + providerId + ", audience=" + getCanonicalAudience()
                + ", nameId=" + nameIdFormat + "}";
    }

    public static final class Builder {

        private final String providerId;
        private List<String> audiences = List.of();
        private NameIdFormat nameIdFormat = NameIdFormat.PERSISTENT;
        private String signingKeyRef;
        private SignatureAlgorithm signatureAlgorithm = SignatureAlgorithm.RSA_SHA256;
        private String recipient;
        private boolean requiresCorrelation;
        private boolean requiresAuthorization;
        private Set<String> requiredAttributes = Set.of();
        private String authorizationAttributeName;
        private String groupsAttributeName;
        private Duration assertionLifetime = Duration.ofMinutes(5);

        private Builder(String providerId) {
            this.providerId = providerId;
        }

        public Builder audiences(List<String> audiences) {
            this.audiences = audiences;
            return this;
        }

        public Builder nameIdFormat(NameIdFormat nameIdFormat) {
            this.nameIdFormat = nameIdFormat;
            return this;
        }

        public Builder signingKeyRef(String signingKeyRef) {
            this.signingKeyRef = signingKeyRef;
            return this;
        }

        public Builder signatureAlgorithm(SignatureAlgorithm signatureAlgorithm) {
            this.signatureAlgorithm = signatureAlgorithm;
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        public Builder requiresCorrelation(boolean requiresCorrelation) {
            this.requiresCorrelation = requiresCorrelation;
            return this;
        }

        public Builder requiresAuthorization(boolean requiresAuthorization) {
            this.requiresAuthorization = requiresAuthorization;
            return this;
        }

        public Builder requiredAttributes(Set<String> requiredAttributes) {
            this.requiredAttributes = requiredAttributes;
            return this;
        }

        public Builder authorizationAttributeName(String authorizationAttributeName) {
            this.authorizationAttributeName = authorizationAttributeName;
            return this;
        }

        public Builder groupsAttributeName(String groupsAttributeName) {
            this.groupsAttributeName = groupsAttributeName;
            return this;
        }

        public Builder assertionLifetime(Duration assertionLifetime) {
            this.assertionLifetime = assertionLifetime;
            return this;
        }

        public TrustedProvider build() {
            if (audiences == null || audiences.isEmpty()) {
                throw new IllegalStateException("Provider " + providerId + " has no audience");
            }
            return new TrustedProvider(this);
        }
    }
}
