package com.github.dominikschlosser.federation.saml;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;

/** Raised by the signing collaborator, or when the assertion cannot be serialized for signing. */
public class SigningException extends FederationException {

    public SigningException(RejectionReason reason, String message) {
        super(reason, message);
    }

    public SigningException(RejectionReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
