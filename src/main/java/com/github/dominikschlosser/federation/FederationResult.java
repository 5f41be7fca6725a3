package com.github.dominikschlosser.federation;

import com.github.dominikschlosser.federation.authorization.AuthorizationHandle;
import com.github.dominikschlosser.federation.correlation.PrincipalHandle;
import com.github.dominikschlosser.federation.saml.SamlAssertion;
import java.util.List;

/**
 * Outcome of {@link FederationEngine#federate}: either an issued, signed assertion or a rejection
 * with a stable reason. Never both.
 */
public final class FederationResult {

    private final String traceId;
    private final String providerId;
    private final RejectionReason reason;
    private final String message;
    private final SamlAssertion assertion;
    private final String signedAssertion;
    private final AuthorizationHandle authorization;
    private final PrincipalHandle principal;
    private final List<FederationState> states;

    private FederationResult(
            String traceId,
            String providerId,
            RejectionReason reason,
            String message,
            SamlAssertion assertion,
            String signedAssertion,
            AuthorizationHandle authorization,
            PrincipalHandle principal,
            List<FederationState> states) {
        this.traceId = traceId;
        this.providerId = providerId;
        this.reason = reason;
        this.message = message;
        this.assertion = assertion;
        this.signedAssertion = signedAssertion;
        this.authorization = authorization;
        this.principal = principal;
        this.states = List.copyOf(states);
    }

    static FederationResult issued(
            FederationTransaction transaction,
            SamlAssertion assertion,
            String signedAssertion,
            AuthorizationHandle authorization,
            PrincipalHandle principal) {
        return new FederationResult(transaction.getTraceId(), transaction.getProviderId(), null, null,
                assertion, signedAssertion, authorization, principal, transaction.getHistory());
    }

    static FederationResult rejected(FederationTransaction transaction, RejectionReason reason, String message) {
        return new FederationResult(transaction.getTraceId(), transaction.getProviderId(), reason, message,
                null, null, null, null, transaction.getHistory());
    }

    public boolean isIssued() {
        return reason == null;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getProviderId() {
        return providerId;
    }

    public RejectionReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public SamlAssertion getAssertion() {
        return assertion;
    }

    /** Signed assertion XML as returned by the signing collaborator. */
    public String getSignedAssertion() {
        return signedAssertion;
    }

    public AuthorizationHandle getAuthorization() {
        return authorization;
    }

    public PrincipalHandle getPrincipal() {
        return principal;
    }

    /** Every state the request went through, starting with {@link FederationState#RECEIVED}. */
    public List<FederationState> getStates() {
        return states;
    }

    @Override
    public String toString() {
        return isIssued()
                ? "issued[trace=" + traceId + ", provider=" + providerId + "]"
                : "rejected:" + reason.getCode() + "[trace=" + traceId + ", provider=" + providerId + "]";
    }
}
