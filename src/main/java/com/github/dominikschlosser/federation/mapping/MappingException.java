package com.github.dominikschlosser.federation.mapping;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;

/** Raised when an identity lacks an attribute the provider marks as required. */
public class MappingException extends FederationException {

    public MappingException(RejectionReason reason, String message) {
        super(reason, message);
    }

    public MappingException(RejectionReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
