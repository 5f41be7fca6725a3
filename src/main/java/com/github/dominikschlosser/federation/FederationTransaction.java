package com.github.dominikschlosser.federation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Tracks the state of a single federation request. Confined to the thread handling the request.
 *
 * <p>States are never re-entered. Once {@link FederationState#ISSUED} or
 * {@link FederationState#REJECTED} is reached every further transition fails.
 */
public class FederationTransaction {

    private static final Logger logger = Logger.getLogger(FederationTransaction.class);

    private final String traceId;
    private final String providerId;
    private final List<FederationState> history = new ArrayList<>();
    private FederationState state = FederationState.RECEIVED;
    private RejectionReason rejectionReason;

    public FederationTransaction(String traceId, String providerId) {
        this.traceId = traceId;
        this.providerId = providerId;
        history.add(state);
    }

    /**
     * @throws IllegalStateException if {@code next} is not a successor of the current state
     */
    public void advance(FederationState next) {
        Objects.requireNonNull(next, "next");
        if (next == FederationState.REJECTED) {
            throw new IllegalStateException("Use reject(reason) to reject trace " + traceId);
        }
        moveTo(next);
    }

    public void reject(RejectionReason reason) {
        Objects.requireNonNull(reason, "reason");
        moveTo(FederationState.REJECTED);
        this.rejectionReason = reason;
    }

    private void moveTo(FederationState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition " + state + " -> " + next + " for trace " + traceId);
        }
        logger.debugf("trace=%s provider=%s: %s -> %s", traceId, providerId, state, next);
        state = next;
        history.add(next);
    }

    public FederationState getState() {
        return state;
    }

    public List<FederationState> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /** @return the reason, or {@code null} unless rejected */
    public RejectionReason getRejectionReason() {
        return rejectionReason;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getProviderId() {
        return providerId;
    }
}
