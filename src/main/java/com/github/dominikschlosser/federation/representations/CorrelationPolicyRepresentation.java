package com.github.dominikschlosser.federation.representations;

/** How a provider that needs pre-existing principals finds them. */
public class CorrelationPolicyRepresentation {

    private String providerId;
    private String attributeKey;
    private String mode;

    public String getProviderId() {
        return providerId;
    }

    public void setProviderId(String providerId) {
        this.providerId = providerId;
    }

    public String getAttributeKey() {
        return attributeKey;
    }

    public void setAttributeKey(String attributeKey) {
        this.attributeKey = attributeKey;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }
}
