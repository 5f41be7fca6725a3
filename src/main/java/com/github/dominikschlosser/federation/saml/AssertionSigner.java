package com.github.dominikschlosser.federation.saml;

import com.github.dominikschlosser.federation.trust.SigningKeyResolver;
import org.keycloak.saml.SignatureAlgorithm;

/**
 * Signing collaborator holding the hub's private keys. The engine hands it unsigned assertion XML
 * and a key reference and never sees key material itself.
 */
public interface AssertionSigner extends SigningKeyResolver {

    /**
     * @return the signed assertion XML
     * @throws SigningException if the key is unavailable or signing fails
     */
    String sign(String unsignedAssertion, String signingKeyRef, SignatureAlgorithm algorithm);
}
