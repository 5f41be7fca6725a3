package com.github.dominikschlosser.federation.dynamicgroup;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.dominikschlosser.federation.Fixtures;
import com.github.dominikschlosser.federation.audit.AuditEmitter;
import com.github.dominikschlosser.federation.audit.InMemoryAuditSink;
import com.github.dominikschlosser.federation.trust.TrustRegistry;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DynamicGroupEvaluatorTest {

    private final AuditEmitter auditEmitter = new AuditEmitter(new InMemoryAuditSink(), Duration.ofSeconds(1));
    private final TrustRegistry registry = new TrustRegistry(Fixtures.SIGNING_KEY::equals, auditEmitter);
    private final DynamicGroupEvaluator evaluator = new DynamicGroupEvaluator(registry);

    @BeforeEach
    void setUp() {
        registry.reload(Fixtures.config());
    }

    @AfterEach
    void tearDown() {
        auditEmitter.close();
    }

    @Test
    void instanceInClinicalDevMatchesItsRule() {
        ResourceIdentity instance = new ResourceIdentity(
                "ocid1.instance.oc1..dev", Map.of("compartment", "clinical-dev", "resource.type", "instance"));

        assertThat(evaluator.evaluate(instance)).contains("clinical-dev-instances");
    }

    @Test
    void instanceInClinicalProdDoesNotMatchTheDevRule() {
        ResourceIdentity instance =
                new ResourceIdentity("ocid1.instance.oc1..prod", Map.of("compartment", "clinical-prod"));

        assertThat(evaluator.evaluate(instance))
                .doesNotContain("clinical-dev-instances")
                .containsExactly("clinical-workloads");
    }

    @Test
    void membershipIsTheUnionOfAllMatchingRules() {
        ResourceIdentity tagged = new ResourceIdentity(
                "ocid1.instance.oc1..batch", Map.of("compartment", "clinical-dev", "tag:workload", "clinical"));

        assertThat(evaluator.evaluate(tagged)).containsExactly("clinical-dev-instances", "clinical-workloads");
    }

    @Test
    void resourceWithoutAttributesMatchesNothing() {
        assertThat(evaluator.evaluate(new ResourceIdentity("ocid1.bucket.oc1..x", null))).isEmpty();
    }

    @Test
    void evaluationIsPure() {
        ResourceIdentity instance =
                new ResourceIdentity("ocid1.instance.oc1..dev", Map.of("compartment", "clinical-dev"));

        assertThat(evaluator.evaluate(instance)).isEqualTo(evaluator.evaluate(instance));
        assertThat(instance.getAttributes()).containsOnly(Map.entry("compartment", "clinical-dev"));
    }
}
