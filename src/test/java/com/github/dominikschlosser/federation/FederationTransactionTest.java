package com.github.dominikschlosser.federation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FederationTransactionTest {

    @Test
    void authorizationPathReachesIssued() {
        FederationTransaction transaction = new FederationTransaction("t-1", Fixtures.AWS);

        transaction.advance(FederationState.MAPPED);
        transaction.advance(FederationState.AUTHORIZED);
        transaction.advance(FederationState.BUILT);
        transaction.advance(FederationState.SIGNED);
        transaction.advance(FederationState.ISSUED);

        assertThat(transaction.getState().isTerminal()).isTrue();
        assertThat(transaction.getRejectionReason()).isNull();
        assertThat(transaction.getHistory()).hasSize(6);
    }

    @Test
    void providerWithoutResolverStepGoesStraightToBuilt() {
        FederationTransaction transaction = new FederationTransaction("t-2", "Plain-Federation");

        transaction.advance(FederationState.MAPPED);
        transaction.advance(FederationState.BUILT);

        assertThat(transaction.getState()).isEqualTo(FederationState.BUILT);
    }

    @Test
    void rejectionIsReachableFromEveryNonTerminalState() {
        for (FederationState state : FederationState.values()) {
            if (state.isTerminal()) {
                continue;
            }
            assertThat(state.canTransitionTo(FederationState.REJECTED)).as(state.name()).isTrue();
        }
    }

    @Test
    void statesAreNeverReEntered() {
        FederationTransaction transaction = new FederationTransaction("t-3", Fixtures.OCI);
        transaction.advance(FederationState.MAPPED);

        assertThatThrownBy(() -> transaction.advance(FederationState.MAPPED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MAPPED -> MAPPED");
    }

    @Test
    void stepsCannotBeSkipped() {
        FederationTransaction transaction = new FederationTransaction("t-4", Fixtures.OCI);

        assertThatThrownBy(() -> transaction.advance(FederationState.SIGNED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void correlationAndAuthorizationAreExclusive() {
        FederationTransaction transaction = new FederationTransaction("t-5", Fixtures.OCI);
        transaction.advance(FederationState.MAPPED);
        transaction.advance(FederationState.CORRELATED);

        assertThatThrownBy(() -> transaction.advance(FederationState.AUTHORIZED))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectedTransactionIsFinal() {
        FederationTransaction transaction = new FederationTransaction("t-6", Fixtures.OCI);
        transaction.advance(FederationState.MAPPED);
        transaction.reject(RejectionReason.NO_USER_FOUND);

        assertThat(transaction.getRejectionReason()).isEqualTo(RejectionReason.NO_USER_FOUND);
        assertThatThrownBy(() -> transaction.reject(RejectionReason.TIMEOUT)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> transaction.advance(FederationState.BUILT)).isInstanceOf(IllegalStateException.class);
        assertThat(transaction.getRejectionReason()).isEqualTo(RejectionReason.NO_USER_FOUND);
    }

    @Test
    void rejectingThroughAdvanceIsRefused() {
        FederationTransaction transaction = new FederationTransaction("t-7", Fixtures.OCI);

        assertThatThrownBy(() -> transaction.advance(FederationState.REJECTED))
                .isInstanceOf(IllegalStateException.class);
    }
}
