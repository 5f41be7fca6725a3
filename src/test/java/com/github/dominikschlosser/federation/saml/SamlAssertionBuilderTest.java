package com.github.dominikschlosser.federation.saml;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.Fixtures;
import com.github.dominikschlosser.federation.RejectionReason;
import com.github.dominikschlosser.federation.authorization.AuthorizationHandle;
import com.github.dominikschlosser.federation.correlation.PrincipalHandle;
import com.github.dominikschlosser.federation.identity.CanonicalIdentity;
import com.github.dominikschlosser.federation.mapping.AttributeSet;
import com.github.dominikschlosser.federation.trust.NameIdFormat;
import com.github.dominikschlosser.federation.trust.TrustedProvider;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.keycloak.dom.saml.v2.assertion.AudienceRestrictionType;

class SamlAssertionBuilderTest {

    private static final String ISSUER = "https://hub.example.com/samlp/healthcare";

    private final SamlAssertionBuilder builder = new SamlAssertionBuilder(Fixtures.clock());

    private final TrustedProvider aws = TrustedProvider.builder(Fixtures.AWS)
            .audiences(List.of("https://signin.aws.amazon.com/saml", "urn:amazon:webservices"))
            .nameIdFormat(NameIdFormat.EMAIL)
            .signingKeyRef(Fixtures.SIGNING_KEY)
            .requiresAuthorization(true)
            .authorizationAttributeName(Fixtures.AWS_ROLE_ATTRIBUTE)
            .assertionLifetime(Duration.ofHours(1))
            .build();

    private final TrustedProvider oci = TrustedProvider.builder(Fixtures.OCI)
            .audiences(List.of("https://idcs-healthcare.identity.oraclecloud.com/fed"))
            .signingKeyRef(Fixtures.SIGNING_KEY)
            .requiresCorrelation(true)
            .build();

    private final AuthorizationHandle physician =
            new AuthorizationHandle("Auth0-Physician-Role", "saml-provider/Auth0");

    @Test
    void audienceIsAlwaysTheCanonicalOne() {
        SamlAssertion assertion = builder.buildAssertion(
                ISSUER, Fixtures.drSmith("Physician"), aws, AttributeSet.empty(), physician);

        AudienceRestrictionType restriction =
                (AudienceRestrictionType) assertion.getAssertionType().getConditions().getConditions().get(0);
        assertThat(restriction.getAudience()).containsExactly(URI.create("https://signin.aws.amazon.com/saml"));
        assertThat(assertion.getAudience()).isEqualTo("https://signin.aws.amazon.com/saml");
        assertThat(assertion.getUnsignedPayload()).doesNotContain("urn:amazon:webservices");
    }

    @Test
    void authorizationHandleIsEmittedAsCombinedValue() {
        AttributeSet mapped = AttributeSet.builder()
                .add(Fixtures.AWS_SESSION_ATTRIBUTE, "dr.smith@example.com", "RoleSessionName")
                .build();

        SamlAssertion assertion = builder.buildAssertion(ISSUER, Fixtures.drSmith("Physician"), aws, mapped, physician);

        assertThat(assertion.getAttributes().getValues(Fixtures.AWS_ROLE_ATTRIBUTE))
                .containsExactly("Auth0-Physician-Role,saml-provider/Auth0");
        assertThat(assertion.getAttributes().getValues(Fixtures.AWS_SESSION_ATTRIBUTE))
                .containsExactly("dr.smith@example.com");
        assertThat(assertion.getUnsignedPayload())
                .contains("Auth0-Physician-Role,saml-provider/Auth0")
                .contains(Fixtures.AWS_ROLE_ATTRIBUTE)
                .contains("RoleSessionName")
                .contains("nameid-format:emailAddress")
                .contains(ISSUER);
    }

    @Test
    void validityWindowFollowsProviderLifetime() {
        SamlAssertion assertion = builder.buildAssertion(
                ISSUER, Fixtures.drSmith("Physician"), aws, AttributeSet.empty(), physician);

        assertThat(assertion.getIssueInstant()).isEqualTo(Fixtures.NOW);
        assertThat(assertion.getNotOnOrAfter()).isEqualTo(Fixtures.NOW.plus(Duration.ofHours(1)));
        assertThat(assertion.getIssuer()).isEqualTo(ISSUER);
    }

    @Test
    void persistentNameIdPrefersCorrelatedPrincipal() {
        PrincipalHandle principal = PrincipalHandle.active("ocid1.user.oc1..smith", "dr.smith");

        SamlAssertion assertion = builder.buildAssertion(
                ISSUER, Fixtures.drSmith(), oci, AttributeSet.empty(), null, principal);

        assertThat(assertion.getNameId()).isEqualTo("ocid1.user.oc1..smith");
        assertThat(assertion.getNameIdFormat()).isEqualTo(NameIdFormat.PERSISTENT);
    }

    @Test
    void persistentNameIdWithoutPrincipalIsStablePairwisePseudonym() {
        CanonicalIdentity smith = Fixtures.drSmith();
        TrustedProvider other = TrustedProvider.builder("Other-Federation")
                .audiences(List.of("https://other.example.com"))
                .build();

        String first = SamlAssertionBuilder.nameIdValue(ISSUER, smith, oci, null);
        String again = SamlAssertionBuilder.nameIdValue(ISSUER, smith, oci, null);
        String elsewhere = SamlAssertionBuilder.nameIdValue(ISSUER, smith, other, null);

        assertThat(first).isEqualTo(again).isNotEqualTo(elsewhere).doesNotContain("dr.smith");
    }

    @Test
    void transientNameIdIsFreshPerAssertion() {
        TrustedProvider transientProvider = TrustedProvider.builder("Transient-Federation")
                .audiences(List.of("https://transient.example.com"))
                .nameIdFormat(NameIdFormat.TRANSIENT)
                .build();

        String first = SamlAssertionBuilder.nameIdValue(ISSUER, Fixtures.drSmith(), transientProvider, null);
        String second = SamlAssertionBuilder.nameIdValue(ISSUER, Fixtures.drSmith(), transientProvider, null);

        assertThat(first).startsWith("_").isNotEqualTo(second);
    }

    @Test
    void assertionWithoutAttributesHasNoAttributeStatement() {
        SamlAssertion assertion = builder.buildAssertion(ISSUER, Fixtures.drSmith(), oci, AttributeSet.empty(), null);

        assertThat(assertion.getAttributes().isEmpty()).isTrue();
        assertThat(assertion.getUnsignedPayload()).doesNotContain("AttributeStatement");
    }

    @Test
    void handleForProviderWithoutRoleAttributeFails() {
        assertThatThrownBy(() -> builder.buildAssertion(
                        ISSUER, Fixtures.drSmith(), oci, AttributeSet.empty(), physician))
                .isInstanceOf(FederationException.class)
                .extracting(e -> ((FederationException) e).getReason())
                .isEqualTo(RejectionReason.ASSERTION_BUILD_FAILED);
    }

    @Test
    void eachAssertionHasItsOwnId() {
        SamlAssertion first = builder.buildAssertion(ISSUER, Fixtures.drSmith(), oci, AttributeSet.empty(), null);
        SamlAssertion second = builder.buildAssertion(ISSUER, Fixtures.drSmith(), oci, AttributeSet.empty(), null);

        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(first.getUnsignedPayload()).contains(first.getId());
    }
}
