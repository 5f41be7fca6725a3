package com.github.dominikschlosser.federation;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of one federation request.
 *
 * <pre>
 * RECEIVED -> MAPPED -> [CORRELATED | AUTHORIZED] -> BUILT -> SIGNED -> ISSUED
 * </pre>
 *
 * <p>{@link #REJECTED} is reachable from every non-terminal state.
 */
public enum FederationState {
    RECEIVED,
    MAPPED,
    CORRELATED,
    AUTHORIZED,
    BUILT,
    SIGNED,
    ISSUED,
    REJECTED;

    public boolean isTerminal() {
        return this == ISSUED || this == REJECTED;
    }

    boolean canTransitionTo(FederationState next) {
        return successors().contains(next);
    }

    private Set<FederationState> successors() {
        switch (this) {
            case RECEIVED:
                return EnumSet.of(MAPPED, REJECTED);
            case MAPPED:
                return EnumSet.of(CORRELATED, AUTHORIZED, BUILT, REJECTED);
            case CORRELATED:
            case AUTHORIZED:
                return EnumSet.of(BUILT, REJECTED);
            case BUILT:
                return EnumSet.of(SIGNED, REJECTED);
            case SIGNED:
                return EnumSet.of(ISSUED, REJECTED);
            default:
                return EnumSet.noneOf(FederationState.class);
        }
    }
}
