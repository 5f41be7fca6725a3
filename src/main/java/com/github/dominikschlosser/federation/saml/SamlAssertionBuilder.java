package com.github.dominikschlosser.federation.saml;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;
import com.github.dominikschlosser.federation.authorization.AuthorizationHandle;
import com.github.dominikschlosser.federation.correlation.PrincipalHandle;
import com.github.dominikschlosser.federation.identity.CanonicalIdentity;
import com.github.dominikschlosser.federation.mapping.AttributeSet;
import com.github.dominikschlosser.federation.trust.NameIdFormat;
import com.github.dominikschlosser.federation.trust.TrustedProvider;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.GregorianCalendar;
import java.util.Objects;
import java.util.UUID;
import javax.xml.datatype.DatatypeConfigurationException;
import javax.xml.datatype.DatatypeFactory;
import javax.xml.datatype.XMLGregorianCalendar;
import javax.xml.stream.XMLStreamWriter;
import org.jboss.logging.Logger;
import org.keycloak.common.util.Base64Url;
import org.keycloak.dom.saml.v2.assertion.AssertionType;
import org.keycloak.dom.saml.v2.assertion.AttributeStatementType;
import org.keycloak.dom.saml.v2.assertion.AttributeType;
import org.keycloak.dom.saml.v2.assertion.AudienceRestrictionType;
import org.keycloak.dom.saml.v2.assertion.ConditionsType;
import org.keycloak.dom.saml.v2.assertion.NameIDType;
import org.keycloak.dom.saml.v2.assertion.SubjectConfirmationDataType;
import org.keycloak.dom.saml.v2.assertion.SubjectConfirmationType;
import org.keycloak.dom.saml.v2.assertion.SubjectType;
import org.keycloak.saml.common.constants.JBossSAMLURIConstants;
import org.keycloak.saml.common.exceptions.ProcessingException;
import org.keycloak.saml.common.util.StaxUtil;
import org.keycloak.saml.processing.core.saml.v2.util.StatementUtil;
import org.keycloak.saml.processing.core.saml.v2.writers.SAMLAssertionWriter;

/**
 * Assembles unsigned SAML 2.0 assertions.
 *
 * <p>The audience restriction always names the provider's canonical audience, the first configured
 * one, even when the provider accepts others. A resolved {@link AuthorizationHandle} is emitted as
 * its own attribute in the {@code "<roleHandle>,<trustHandle>"} encoding. Key material is never
 * touched here; the payload goes to an {@link AssertionSigner}.
 */
public class SamlAssertionBuilder {

    private static final Logger logger = Logger.getLogger(SamlAssertionBuilder.class);

    private static final String AUTHN_CONTEXT_UNSPECIFIED = "urn:oasis:names:tc:SAML:2.0:ac:classes:unspecified";

    private final Clock clock;
    private final DatatypeFactory datatypeFactory;

    public SamlAssertionBuilder() {
        this(Clock.systemUTC());
    }

    public SamlAssertionBuilder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            this.datatypeFactory = DatatypeFactory.newInstance();
        } catch (DatatypeConfigurationException e) {
            throw new IllegalStateException("No XML datatype factory available", e);
        }
    }

    public SamlAssertion buildAssertion(
            String issuer,
            CanonicalIdentity identity,
            TrustedProvider provider,
            AttributeSet attributes,
            AuthorizationHandle authorization) {
        return buildAssertion(issuer, identity, provider, attributes, authorization, null);
    }

    /**
     * @param authorization may be {@code null} for providers that do not federate roles
     * @param principal the correlated principal, or {@code null}; used for persistent NameIDs
     * @throws FederationException {@link RejectionReason#ASSERTION_BUILD_FAILED}
     */
    public SamlAssertion buildAssertion(
            String issuer,
            CanonicalIdentity identity,
            TrustedProvider provider,
            AttributeSet attributes,
            AuthorizationHandle authorization,
            PrincipalHandle principal) {
        AttributeSet statementAttributes = withAuthorization(provider, attributes, authorization);

        Instant issueInstant = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant notOnOrAfter = issueInstant.plus(provider.getAssertionLifetime());
        XMLGregorianCalendar issued = toXml(issueInstant);
        XMLGregorianCalendar expires = toXml(notOnOrAfter);

        String id = "ID_" + UUID.randomUUID();
        String audience = provider.getCanonicalAudience();
        NameIdFormat format = provider.getNameIdFormat();
        String nameIdValue = nameIdValue(issuer, identity, provider, principal);

        AssertionType assertion = new AssertionType(id, issued);

        NameIDType issuerId = new NameIDType();
        issuerId.setValue(issuer);
        issuerId.setFormat(JBossSAMLURIConstants.NAMEID_FORMAT_ENTITY.getUri());
        assertion.setIssuer(issuerId);

        assertion.setSubject(subject(nameIdValue, format, provider.getRecipient(), expires));

        ConditionsType conditions = new ConditionsType();
        conditions.setNotBefore(issued);
        conditions.setNotOnOrAfter(expires);
        AudienceRestrictionType audienceRestriction = new AudienceRestrictionType();
        audienceRestriction.addAudience(URI.create(audience));
        conditions.addCondition(audienceRestriction);
        assertion.setConditions(conditions);

        assertion.addStatement(
                StatementUtil.createAuthnStatement(toXml(identity.getIssuedAt()), AUTHN_CONTEXT_UNSPECIFIED));

        if (!statementAttributes.isEmpty()) {
            assertion.addStatement(attributeStatement(statementAttributes));
        }

        String payload = write(assertion, provider.getProviderId());
        logger.debugf("trace=%s: built assertion %s for %s (audience=%s, format=%s, %d attributes)",
                identity.getTraceId(), id, provider.getProviderId(), audience, format,
                statementAttributes.getNames().size());

        return new SamlAssertion(id, issuer, audience, nameIdValue, format, statementAttributes,
                issueInstant, notOnOrAfter, assertion, payload);
    }

    private static AttributeSet withAuthorization(
            TrustedProvider provider, AttributeSet attributes, AuthorizationHandle authorization) {
        if (authorization == null) {
            return attributes;
        }
        String attributeName = provider.getAuthorizationAttributeName();
        if (attributeName == null) {
            throw new FederationException(
                    RejectionReason.ASSERTION_BUILD_FAILED,
                    "Provider " + provider.getProviderId() + " has no attribute to carry the authorization handle");
        }
        if (attributes.contains(attributeName)) {
            throw new FederationException(
                    RejectionReason.ASSERTION_BUILD_FAILED,
                    "Attribute " + attributeName + " is already set by an attribute mapping");
        }
        return attributes.toBuilder().add(attributeName, authorization.encode()).build();
    }

    private static SubjectType subject(
            String nameIdValue, NameIdFormat format, String recipient, XMLGregorianCalendar expires) {
        NameIDType nameId = new NameIDType();
        nameId.setValue(nameIdValue);
        nameId.setFormat(format.getUri().getUri());

        SubjectType subject = new SubjectType();
        SubjectType.STSubType subType = new SubjectType.STSubType();
        subType.addBaseID(nameId);
        subject.setSubType(subType);

        SubjectConfirmationDataType confirmationData = new SubjectConfirmationDataType();
        confirmationData.setRecipient(recipient);
        confirmationData.setNotOnOrAfter(expires);

        SubjectConfirmationType confirmation = new SubjectConfirmationType();
        confirmation.setMethod(JBossSAMLURIConstants.SUBJECT_CONFIRMATION_BEARER.get());
        confirmation.setSubjectConfirmationData(confirmationData);
        subject.addConfirmation(confirmation);
        return subject;
    }

    private static AttributeStatementType attributeStatement(AttributeSet attributes) {
        AttributeStatementType statement = new AttributeStatementType();
        for (String name : attributes.getNames()) {
            AttributeType attribute = new AttributeType(name);
            attribute.setNameFormat(name.contains(":")
                    ? JBossSAMLURIConstants.ATTRIBUTE_FORMAT_URI.get()
                    : JBossSAMLURIConstants.ATTRIBUTE_FORMAT_BASIC.get());
            String friendlyName = attributes.getFriendlyName(name);
            if (friendlyName != null) {
                attribute.setFriendlyName(friendlyName);
            }
            for (String value : attributes.getValues(name)) {
                attribute.addAttributeValue(value);
            }
            statement.addAttribute(new AttributeStatementType.ASTChoiceType(attribute));
        }
        return statement;
    }

    static String nameIdValue(
            String issuer, CanonicalIdentity identity, TrustedProvider provider, PrincipalHandle principal) {
        switch (provider.getNameIdFormat()) {
            case EMAIL:
                return identity.getSubject();
            case TRANSIENT:
                return "_" + UUID.randomUUID();
            case PERSISTENT:
            default:
                if (principal != null) {
                    return principal.getPrincipalId();
                }
                return pairwiseId(issuer, provider.getProviderId(), identity.getSubject());
        }
    }

    private static String pairwiseId(String issuer, String providerId, String subject) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((issuer + "|" + providerId + "|" + subject).getBytes(StandardCharsets.UTF_8));
            return Base64Url.encode(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String write(AssertionType assertion, String providerId) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            XMLStreamWriter writer = StaxUtil.getXMLStreamWriter(out);
            new SAMLAssertionWriter(writer).write(assertion);
            StaxUtil.flush(writer);
        } catch (ProcessingException e) {
            throw new FederationException(
                    RejectionReason.ASSERTION_BUILD_FAILED, "Could not serialize assertion for " + providerId, e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private XMLGregorianCalendar toXml(Instant instant) {
        return datatypeFactory.newXMLGregorianCalendar(GregorianCalendar.from(instant.atZone(ZoneOffset.UTC)));
    }
}
