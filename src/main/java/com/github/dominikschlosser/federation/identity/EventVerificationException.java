package com.github.dominikschlosser.federation.identity;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;

/** Raised when a hub login event fails signature verification or cannot be parsed. */
public class EventVerificationException extends FederationException {

    public EventVerificationException(RejectionReason reason, String message) {
        super(reason, message);
    }

    public EventVerificationException(RejectionReason reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
