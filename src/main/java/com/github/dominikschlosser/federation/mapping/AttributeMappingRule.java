package com.github.dominikschlosser.federation.mapping;

import java.util.Objects;

/**
 * Copies the verified hub attribute {@code sourceAttribute} to the provider attribute
 * {@code targetAttribute}. At most one rule per provider may write a given target.
 */
public final class AttributeMappingRule {

    private final String providerId;
    private final String sourceAttribute;
    private final String targetAttribute;
    private final String friendlyName;

    public AttributeMappingRule(
            String providerId, String sourceAttribute, String targetAttribute, String friendlyName) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.sourceAttribute = Objects.requireNonNull(sourceAttribute, "sourceAttribute");
        this.targetAttribute = Objects.requireNonNull(targetAttribute, "targetAttribute");
        this.friendlyName = friendlyName;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getSourceAttribute() {
        return sourceAttribute;
    }

    public String getTargetAttribute() {
        return targetAttribute;
    }

    public String getFriendlyName() {
        return friendlyName;
    }

    @Override
    public String toString() {
        return providerId + ":" + sourceAttribute + "->" + targetAttribute;
    }
}
