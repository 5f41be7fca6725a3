package com.github.dominikschlosser.federation.representations;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.List;

/**
 * Relying-party metadata as it appears in the configuration document.
 *
 * <p>{@code audiences} and {@code requiredAttributes} accept either a JSON array or a single
 * comma-separated string, e.g. {@code "https://signin.aws.amazon.com/saml, urn:amazon:webservices"}.
 */
public class TrustedProviderRepresentation {

    private String providerId;

    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> audiences;

    private String nameIdFormat;
    private String signingKeyRef;
    private String signatureAlgorithm;
    private String recipient;
    private Boolean requiresCorrelation;
    private Boolean requiresAuthorization;

    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> requiredAttributes;

    private String authorizationAttributeName;
    private String groupsAttributeName;
    private Integer assertionLifetimeSeconds;

    public String getProviderId() {
        return providerId;
    }

    public void setProviderId(String providerId) {
        this.providerId = providerId;
    }

    public List<String> getAudiences() {
        return audiences;
    }

    public void setAudiences(List<String> audiences) {
        this.audiences = audiences;
    }

    public String getNameIdFormat() {
        return nameIdFormat;
    }

    public void setNameIdFormat(String nameIdFormat) {
        this.nameIdFormat = nameIdFormat;
    }

    public String getSigningKeyRef() {
        return signingKeyRef;
    }

    public void setSigningKeyRef(String signingKeyRef) {
        this.signingKeyRef = signingKeyRef;
    }

    public String getSignatureAlgorithm() {
        return signatureAlgorithm;
    }

    public void setSignatureAlgorithm(String signatureAlgorithm) {
        this.signatureAlgorithm = signatureAlgorithm;
    }

    public String getRecipient() {
        return recipient;
    }

    public void setRecipient(String recipient) {
        this.recipient = recipient;
    }

    public Boolean getRequiresCorrelation() {
        return requiresCorrelation;
    }

    public void setRequiresCorrelation(Boolean requiresCorrelation) {
        this.requiresCorrelation = requiresCorrelation;
    }

    public Boolean getRequiresAuthorization() {
        return requiresAuthorization;
    }

    public void setRequiresAuthorization(Boolean requiresAuthorization) {
        this.requiresAuthorization = requiresAuthorization;
    }

    public List<String> getRequiredAttributes() {
        return requiredAttributes;
    }

    public void setRequiredAttributes(List<String> requiredAttributes) {
        this.requiredAttributes = requiredAttributes;
    }

    public String getAuthorizationAttributeName() {
        return authorizationAttributeName;
    }

    public void setAuthorizationAttributeName(String authorizationAttributeName) {
        this.authorizationAttributeName = authorizationAttributeName;
    }

    public String getGroupsAttributeName() {
        return groupsAttributeName;
    }

    public void setGroupsAttributeName(String groupsAttributeName) {
        this.groupsAttributeName = groupsAttributeName;
    }

    public Integer getAssertionLifetimeSeconds() {
        return assertionLifetimeSeconds;
    }

    public void setAssertionLifetimeSeconds(Integer assertionLifetimeSeconds) {
        this.assertionLifetimeSeconds = assertionLifetimeSeconds;
    }
}
