package com.github.dominikschlosser.federation.identity;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of a subject authenticated by the identity hub.
 *
 * <p>Created once per login event and owned by the request pipeline for its lifetime. Attributes
 * and groups are kept sorted so that everything derived from an identity is deterministic.
 */
public final class CanonicalIdentity {

    private final String subject;
    private final Map<String, String> verifiedAttributes;
    private final Set<String> groups;
    private final Instant issuedAt;
    private final String traceId;

    private CanonicalIdentity(Builder builder) {
        this.subject = requireText(builder.subject, "subject");
        this.traceId = requireText(builder.traceId, "traceId");
        this.issuedAt = Objects.requireNonNull(builder.issuedAt, "issuedAt");
        this.verifiedAttributes = Collections.unmodifiableMap(new TreeMap<>(builder.verifiedAttributes));
        this.groups = Collections.unmodifiableSet(new TreeSet<>(builder.groups));
    }

    public static Builder builder(String subject) {
        return new Builder(subject);
    }

    public String getSubject() {
        return subject;
    }

    public Map<String, String> getVerifiedAttributes() {
        return verifiedAttributes;
    }

    public String getAttribute(String key) {
        return verifiedAttributes.get(key);
    }

    public Set<String> getGroups() {
        return groups;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public String getTraceId() {
        return traceId;
    }

    @Override
    public String toString() {
        // attribute values stay out of logs
        return "CanonicalIdentity{subject=" + subject + ", traceId=" + traceId + ", groups=" + groups + "}";
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    public static final class Builder {

        private final String subject;
        private final Map<String, String> verifiedAttributes = new TreeMap<>();
        private final Set<String> groups = new TreeSet<>();
        private Instant issuedAt = Instant.now();
        private String traceId;

        private Builder(String subject) {
            this.subject = subject;
        }

        public Builder attribute(String key, String value) {
            if (key != null && value != null) {
                verifiedAttributes.put(key, value);
            }
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public Builder group(String groupId) {
            if (groupId != null && !groupId.isBlank()) {
                groups.add(groupId);
            }
            return this;
        }

        public Builder groups(Iterable<String> groupIds) {
            if (groupIds != null) {
                groupIds.forEach(this::group);
            }
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public CanonicalIdentity build() {
            return new CanonicalIdentity(this);
        }
    }
}
