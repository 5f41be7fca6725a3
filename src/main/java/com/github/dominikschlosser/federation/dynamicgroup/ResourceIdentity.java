package com.github.dominikschlosser.federation.dynamicgroup;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A non-human principal, such as a compute instance, described by its scope attributes
 * ({@code compartment}, {@code tenancy}, {@code resource.type}, ...).
 */
public final class ResourceIdentity {

    private final String resourceId;
    private final Map<String, String> attributes;

    public ResourceIdentity(String resourceId, Map<String, String> attributes) {
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
        this.attributes = Collections.unmodifiableMap(new TreeMap<>(attributes == null ? Map.of() : attributes));
    }

    public String getResourceId() {
        return resourceId;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public String toString() {
        return "ResourceIdentity{" + resourceId + ", " + attributes + "}";
    }
}
