package com.github.dominikschlosser.federation.correlation;

import java.io.IOException;
import java.util.List;

/**
 * Directory of a provider whose principals must exist before they can federate. Implementations
 * talk to the provider's identity API and may block; the caller bounds every call with a timeout
 * and interrupts it on cancellation.
 */
public interface PrincipalDirectory {

    /**
     * Looks up principals whose {@code attributeKey} equals {@code attributeValue}.
     *
     * @return every match, possibly none; never {@code null}
     * @throws IOException if the directory cannot be reached
     */
    List<PrincipalHandle> lookupPrincipal(String providerId, String attributeKey, String attributeValue)
            throws IOException;
}
