package com.github.dominikschlosser.federation.trust;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dominikschlosser.federation.Fixtures;
import com.github.dominikschlosser.federation.RejectionReason;
import com.github.dominikschlosser.federation.correlation.CorrelationMode;
import com.github.dominikschlosser.federation.representations.AttributeMappingRepresentation;
import com.github.dominikschlosser.federation.representations.DynamicGroupRuleRepresentation;
import com.github.dominikschlosser.federation.representations.FederationConfigRepresentation;
import com.github.dominikschlosser.federation.representations.RoleBindingRepresentation;
import com.github.dominikschlosser.federation.representations.TrustedProviderRepresentation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.keycloak.saml.SignatureAlgorithm;

class ConfigurationValidatorTest {

    private final ConfigurationValidator validator = new ConfigurationValidator(Fixtures.SIGNING_KEY::equals);

    @Test
    void fixtureIsValid() {
        FederationConfiguration config = validator.validate(Fixtures.config());

        assertThat(config.getVersion()).isEqualTo("2024-06-01");
        assertThat(config.getProviders()).containsOnlyKeys(Fixtures.AWS, Fixtures.OCI);

        TrustedProvider aws = config.getProvider(Fixtures.AWS).orElseThrow();
        assertThat(aws.getAudiences()).containsExactly("https://signin.aws.amazon.com/saml", "urn:amazon:webservices");
        assertThat(aws.getCanonicalAudience()).isEqualTo("https://signin.aws.amazon.com/saml");
        assertThat(aws.acceptsAudience("urn:amazon:webservices")).isTrue();
        assertThat(aws.getNameIdFormat()).isEqualTo(NameIdFormat.EMAIL);
        assertThat(aws.getSignatureAlgorithm()).isEqualTo(SignatureAlgorithm.RSA_SHA256);
        assertThat(aws.getAssertionLifetime()).isEqualTo(Duration.ofHours(1));

        TrustedProvider oci = config.getProvider(Fixtures.OCI).orElseThrow();
        assertThat(oci.getAudiences()).containsExactly("https://idcs-healthcare.identity.oraclecloud.com/fed");
        assertThat(oci.getRecipient()).isEqualTo("https://idcs-healthcare.identity.oraclecloud.com/fed");
        assertThat(oci.getAssertionLifetime()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getCorrelationPolicy(Fixtures.OCI).orElseThrow().getMode())
                .isEqualTo(CorrelationMode.MATCH_EXISTING_OR_REJECT);
        assertThat(config.getDynamicGroupRules()).hasSize(2);
    }

    @Test
    void invalidProviderAlsoInvalidatesEntriesReferencingIt() {
        FederationConfigRepresentation rep = Fixtures.config();
        provider(rep, Fixtures.AWS).setAudiences(null);

        assertThat(errorsOf(rep)).contains(
                "attribute mapping AWS-Federation:" + Fixtures.AWS_SESSION_ATTRIBUTE + ": unknown provider",
                "role binding AWS-Federation:Physician: unknown provider");
    }

    @Test
    void providerWithoutAudienceIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        provider(rep, Fixtures.AWS).setAudiences(List.of(" "));

        assertThat(errorsOf(rep)).first().isEqualTo("provider AWS-Federation: at least one audience is required");
    }

    @Test
    void audienceThatIsNotAUriIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        provider(rep, Fixtures.AWS).setAudiences(List.of("https://signin.aws.amazon.com/ saml"));

        assertThat(errorsOf(rep)).first().isEqualTo(
                "provider AWS-Federation: audience 'https://signin.aws.amazon.com/ saml' is not a valid URI");
    }

    @Test
    void recipientThatIsNotAUriIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        provider(rep, Fixtures.OCI).setRecipient("https://idcs example/fed");

        assertThat(errorsOf(rep)).first().isEqualTo(
                "provider OCI-Federation: recipient 'https://idcs example/fed' is not a valid URI");
    }

    @Test
    void deeplyNestedDynamicGroupRuleIsAConfigurationError() {
        FederationConfigRepresentation rep = Fixtures.config();
        DynamicGroupRuleRepresentation rule = new DynamicGroupRuleRepresentation();
        rule.setGroupId("too-deep");
        rule.setMatchingRule("ANY {".repeat(20_000) + "compartment = a" + "}".repeat(20_000));
        rep.getDynamicGroupRules().add(rule);

        assertThat(errorsOf(rep)).singleElement().asString()
                .startsWith("dynamic group too-deep: ")
                .contains("nested deeper than");
    }

    @Test
    void unknownNameIdFormatIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        provider(rep, Fixtures.OCI).setNameIdFormat("kerberos");

        assertThat(errorsOf(rep)).first().asString().contains("Unsupported NameID format");
    }

    @Test
    void unresolvableSigningKeyIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        provider(rep, Fixtures.OCI).setSigningKeyRef("retired-key");

        assertThat(errorsOf(rep)).first().asString().contains("retired-key cannot be resolved");
    }

    @Test
    void twoRulesWritingTheSameTargetAreRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        AttributeMappingRepresentation duplicate = new AttributeMappingRepresentation();
        duplicate.setProviderId(Fixtures.AWS);
        duplicate.setSourceAttribute("name");
        duplicate.setTargetAttribute(Fixtures.AWS_SESSION_ATTRIBUTE);
        rep.getAttributeMappings().add(duplicate);

        assertThat(errorsOf(rep)).singleElement().asString()
                .contains("target attribute is written by more than one rule");
    }

    @Test
    void mappingOntoTheRoleAttributeIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        AttributeMappingRepresentation role = new AttributeMappingRepresentation();
        role.setProviderId(Fixtures.AWS);
        role.setSourceAttribute("role");
        role.setTargetAttribute(Fixtures.AWS_ROLE_ATTRIBUTE);
        rep.getAttributeMappings().add(role);

        assertThat(errorsOf(rep)).singleElement().asString().contains("reserved for role or group statements");
    }

    @Test
    void roleBindingWithoutPrecedenceIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        rep.getRoleBindings().get(0).setPrecedence(null);

        assertThat(errorsOf(rep)).containsExactly("role binding AWS-Federation:Physician: precedence is required");
    }

    @Test
    void handleContainingSeparatorIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        RoleBindingRepresentation binding = rep.getRoleBindings().get(0);
        binding.setRoleHandle("arn:aws:iam::123:role/A,B");

        assertThat(errorsOf(rep)).singleElement().asString().contains("must not contain ','");
    }

    @Test
    void authorizationProviderWithoutBindingsIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        rep.getRoleBindings().clear();

        assertThat(errorsOf(rep))
                .containsExactly("provider AWS-Federation: requires authorization but has no role bindings");
    }

    @Test
    void correlatingProviderWithoutPolicyIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        rep.getCorrelationPolicies().clear();

        assertThat(errorsOf(rep)).containsExactly("provider OCI-Federation: requires correlation but has no policy");
    }

    @Test
    void providerRequiringCorrelationAndAuthorizationIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        provider(rep, Fixtures.OCI).setRequiresAuthorization(true);
        provider(rep, Fixtures.OCI).setAuthorizationAttributeName("urn:oci:role");

        assertThat(errorsOf(rep)).anySatisfy(error -> assertThat(error).contains("not both"));
    }

    @Test
    void malformedDynamicGroupRuleIsRejected() {
        FederationConfigRepresentation rep = Fixtures.config();
        DynamicGroupRuleRepresentation rule = new DynamicGroupRuleRepresentation();
        rule.setGroupId("broken");
        rule.setMatchingRule("compartment ~ clinical");
        rep.getDynamicGroupRules().add(rule);

        assertThat(errorsOf(rep)).singleElement().asString().startsWith("dynamic group broken: ");
    }

    @Test
    void allErrorsAreReportedTogether() {
        FederationConfigRepresentation rep = Fixtures.config();
        rep.setVersion(null);
        provider(rep, Fixtures.AWS).setSigningKeyRef(null);
        rep.getCorrelationPolicies().clear();

        ConfigurationException error = catchConfigurationException(rep);

        assertThat(error.getReason()).isEqualTo(RejectionReason.INVALID_CONFIGURATION);
        assertThat(error.getErrors()).contains(
                "version is required",
                "provider AWS-Federation: signingKeyRef is required",
                "provider OCI-Federation: requires correlation but has no policy");
    }

    @Test
    void commaSeparatedListsAreSplit() {
        assertThat(ConfigurationValidator.splitList(List.of("a, b", "b", " ", "c")))
                .containsExactly("a", "b", "c");
        assertThat(ConfigurationValidator.splitList(null)).isEmpty();
        assertThat(ConfigurationValidator.splitList(null)).isInstanceOf(ArrayList.class);
        assertThat(ConfigurationValidator.splitList(List.of("a"))).isInstanceOf(ArrayList.class);
    }

    @Test
    void emptyDocumentIsRejected() {
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("empty");
    }

    private static TrustedProviderRepresentation provider(FederationConfigRepresentation rep, String providerId) {
        return rep.getProviders().stream()
                .filter(p -> p.getProviderId().equals(providerId))
                .findFirst()
                .orElseThrow();
    }

    private List<String> errorsOf(FederationConfigRepresentation rep) {
        return catchConfigurationException(rep).getErrors();
    }

    private ConfigurationException catchConfigurationException(FederationConfigRepresentation rep) {
        try {
            validator.validate(rep);
        } catch (ConfigurationException e) {
            return e;
        }
        throw new AssertionError("Expected configuration to be rejected");
    }
}
