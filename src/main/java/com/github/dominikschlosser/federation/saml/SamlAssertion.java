package com.github.dominikschlosser.federation.saml;

import com.github.dominikschlosser.federation.mapping.AttributeSet;
import com.github.dominikschlosser.federation.trust.NameIdFormat;
import java.time.Instant;
import org.keycloak.dom.saml.v2.assertion.AssertionType;

/**
 * An unsigned SAML 2.0 assertion built for exactly one request. Never cached or reused; a new
 * request always gets a new assertion id.
 */
public final class SamlAssertion {

    private final String id;
    private final String issuer;
    private final String audience;
    private final String nameId;
    private final NameIdFormat nameIdFormat;
    private final AttributeSet attributes;
    private final Instant issueInstant;
    private final Instant notOnOrAfter;
    private final AssertionType assertionType;
    private final String unsignedPayload;

    SamlAssertion(
            String id,
            String issuer,
            String audience,
            String nameId,
            NameIdFormat nameIdFormat,
            AttributeSet attributes,
            Instant issueInstant,
            Instant notOnOrAfter,
            AssertionType assertionType,
            String unsignedPayload) {
        this.id = id;
        this.issuer = issuer;
        this.audience = audience;
        this.nameId = nameId;
        this.nameIdFormat = nameIdFormat;
        this.attributes = attributes;
        this.issueInstant = issueInstant;
        this.notOnOrAfter = notOnOrAfter;
        this.assertionType = assertionType;
        this.unsignedPayload = unsignedPayload;
    }

    public String getId() {
        return id;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getAudience() {
        return audience;
    }

    public String getNameId() {
        return nameId;
    }

    public NameIdFormat getNameIdFormat() {
        return nameIdFormat;
    }

    /** Everything in the attribute statement, including role and group attributes. */
    public AttributeSet getAttributes() {
        return attributes;
    }

    public Instant getIssueInstant() {
        return issueInstant;
    }

    public Instant getNotOnOrAfter() {
        return notOnOrAfter;
    }

    /** The Keycloak SAML object model of this assertion. */
    public AssertionType getAssertionType() {
        return assertionType;
    }

    /** Serialized {@code <saml:Assertion>} XML, ready for the signing collaborator. */
    public String getUnsignedPayload() {
        return unsignedPayload;
    }
}
