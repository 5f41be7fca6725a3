package com.github.dominikschlosser.federation.correlation;

import java.util.Objects;

public final class CorrelationPolicy {

    private final String providerId;
    private final String attributeKey;
    private final CorrelationMode mode;

    public CorrelationPolicy(String providerId, String attributeKey, CorrelationMode mode) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.attributeKey = Objects.requireNonNull(attributeKey, "attributeKey");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public String getProviderId() {
        return providerId;
    }

    /** Verified attribute whose value is looked up in the provider directory, e.g. {@code email}. */
    public String getAttributeKey() {
        return attributeKey;
    }

    public CorrelationMode getMode() {
        return mode;
    }
}
