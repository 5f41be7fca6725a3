package com.github.dominikschlosser.federation.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.Fixtures;
import com.github.dominikschlosser.federation.RejectionReason;
import com.github.dominikschlosser.federation.audit.AuditEmitter;
import com.github.dominikschlosser.federation.audit.InMemoryAuditSink;
import com.github.dominikschlosser.federation.identity.CanonicalIdentity;
import com.github.dominikschlosser.federation.trust.FederationConfiguration;
import com.github.dominikschlosser.federation.trust.TrustRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttributeMappingEngineTest {

    private final AuditEmitter auditEmitter = new AuditEmitter(new InMemoryAuditSink(), Duration.ofSeconds(1));
    private final TrustRegistry registry = new TrustRegistry(Fixtures.SIGNING_KEY::equals, auditEmitter);
    private final AttributeMappingEngine engine = new AttributeMappingEngine(registry);
    private FederationConfiguration config;

    @BeforeEach
    void setUp() {
        config = registry.reload(Fixtures.config());
    }

    @AfterEach
    void tearDown() {
        auditEmitter.close();
    }

    @Test
    void usesTheActiveSnapshotByDefault() {
        AttributeSet attributes = engine.mapAttributes(Fixtures.drSmith(), Fixtures.AWS);

        assertThat(attributes.getValues(Fixtures.AWS_SESSION_ATTRIBUTE)).containsExactly("dr.smith@example.com");
        assertThat(attributes.getFriendlyName(Fixtures.AWS_SESSION_ATTRIBUTE)).isEqualTo("RoleSessionName");
    }

    @Test
    void mapsConfiguredAttributesOntoProviderUris() {
        AttributeSet attributes = engine.mapAttributes(config, Fixtures.drSmith("Physician"), Fixtures.OCI);

        assertThat(attributes.getNames()).containsExactly(
                "urn:oid:0.9.2342.19200300.100.1.3", "urn:oid:2.16.840.1.113730.3.1.241");
        assertThat(attributes.getFirstValue("urn:oid:0.9.2342.19200300.100.1.3")).isEqualTo("dr.smith@example.com");
        assertThat(attributes.getFriendlyName("urn:oid:2.16.840.1.113730.3.1.241")).isEqualTo("displayName");
    }

    @Test
    void absentOptionalSourceAttributeIsSkipped() {
        CanonicalIdentity identity = CanonicalIdentity.builder("nurse@example.com")
                .attribute("email", "nurse@example.com")
                .traceId("trace-nurse")
                .build();

        AttributeSet attributes = engine.mapAttributes(config, identity, Fixtures.OCI);

        assertThat(attributes.getNames()).containsExactly("urn:oid:0.9.2342.19200300.100.1.3");
    }

    @Test
    void missingRequiredAttributeFails() {
        CanonicalIdentity identity = CanonicalIdentity.builder("dr.smith@example.com")
                .attribute("name", "Dr. Jane Smith")
                .traceId("trace-smith")
                .build();

        assertThatThrownBy(() -> engine.mapAttributes(config, identity, Fixtures.AWS))
                .isInstanceOf(MappingException.class)
                .hasMessageContaining("'email'")
                .extracting(e -> ((MappingException) e).getReason())
                .isEqualTo(RejectionReason.REQUIRED_ATTRIBUTE_MISSING);
    }

    @Test
    void unknownProviderFails() {
        assertThatThrownBy(() -> engine.mapAttributes(config, Fixtures.drSmith(), "GCP-Federation"))
                .isInstanceOf(FederationException.class)
                .extracting(e -> ((FederationException) e).getReason())
                .isEqualTo(RejectionReason.UNKNOWN_PROVIDER);
    }

    @Test
    void sameInputGivesEqualOutput() {
        AttributeSet first = engine.mapAttributes(config, Fixtures.drSmith("Physician"), Fixtures.OCI);
        AttributeSet second = engine.mapAttributes(config, Fixtures.drSmith("Physician"), Fixtures.OCI);

        assertThat(first).isEqualTo(second);
        assertThat(first.toString()).isEqualTo(second.toString());
    }

    @Test
    void attributeSetBuilderKeepsValuesInInsertionOrderPerName() {
        AttributeSet set = AttributeSet.builder()
                .add("groups", "b")
                .add("groups", "a")
                .add("email", "x@example.com", "mail")
                .build();

        assertThat(set.getNames()).containsExactly("email", "groups");
        assertThat(set.getValues("groups")).containsExactly("b", "a");
        assertThat(set.getValues("missing")).isEmpty();
        assertThat(set.toBuilder().add("groups", "c").build().getValues("groups")).containsExactly("b", "a", "c");
        assertThat(set.getValues("groups")).hasSize(2);
    }
}
