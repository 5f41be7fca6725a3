package com.github.dominikschlosser.federation.authorization;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;

/** Raised when the group memberships of an identity do not resolve to exactly one role binding. */
public class AuthorizationException extends FederationException {

    public AuthorizationException(RejectionReason reason, String message) {
        super(reason, message);
    }

    public AuthorizationException(RejectionReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
