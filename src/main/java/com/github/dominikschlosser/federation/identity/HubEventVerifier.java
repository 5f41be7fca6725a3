package com.github.dominikschlosser.federation.identity;

/**
 * Verifies a hub login event against the hub's known key and turns it into a
 * {@link CanonicalIdentity}. Nothing downstream looks at an event that has not passed through here.
 */
public interface HubEventVerifier {

    /**
     * @throws EventVerificationException if the signature does not match or the payload is malformed
     */
    CanonicalIdentity verify(SignedHubEvent event);
}
