package com.github.dominikschlosser.federation.correlation;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;

/** Raised when an identity cannot be resolved to exactly one principal of the target provider. */
public class CorrelationException extends FederationException {

    public CorrelationException(RejectionReason reason, String message) {
        super(reason, message);
    }

    public CorrelationException(RejectionReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
