package com.github.dominikschlosser.federation;

/**
 * Base class of every failure raised while translating an identity or loading configuration.
 *
 * <p>Each failure carries a {@link RejectionReason}; callers decide on the reason, never on the
 * message text.
 */
public class FederationException extends RuntimeException {

    private final RejectionReason reason;

    public FederationException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FederationException(RejectionReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public RejectionReason getReason() {
        return reason;
    }
}
