package com.github.dominikschlosser.federation;

import com.github.dominikschlosser.federation.identity.CanonicalIdentity;
import com.github.dominikschlosser.federation.representations.FederationConfigRepresentation;
import com.github.dominikschlosser.federation.trust.ConfigurationLoader;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/** Shared test data around {@code federation-config.json}. */
public final class Fixtures {

    public static final String CONFIG_RESOURCE = "federation-config.json";
    public static final String AWS = "AWS-Federation";
    public static final String OCI = "OCI-Federation";
    public static final String SIGNING_KEY = "hub-signing-key";
    public static final String AWS_ROLE_ATTRIBUTE = "https://aws.amazon.com/SAML/Attributes/Role";
    public static final String AWS_SESSION_ATTRIBUTE = "https://aws.amazon.com/SAML/Attributes/RoleSessionName";
    public static final Instant NOW = Instant.parse("2024-06-01T10:15:30Z");

    private Fixtures() {}

    public static FederationConfigRepresentation config() {
        return ConfigurationLoader.loadResource(CONFIG_RESOURCE);
    }

    public static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static CanonicalIdentity drSmith(String... groups) {
        return CanonicalIdentity.builder("dr.smith@example.com")
                .attribute("email", "dr.smith@example.com")
                .attribute("name", "Dr. Jane Smith")
                .groups(List.of(groups))
                .issuedAt(NOW.minusSeconds(2))
                .traceId("trace-smith")
                .build();
    }
}
