package com.github.dominikschlosser.federation.correlation;

import com.github.dominikschlosser.federation.FederationException;
import com.github.dominikschlosser.federation.RejectionReason;
import com.github.dominikschlosser.federation.audit.AuditEmitter;
import com.github.dominikschlosser.federation.audit.AuditEventType;
import com.github.dominikschlosser.federation.audit.AuditOutcome;
import com.github.dominikschlosser.federation.identity.CanonicalIdentity;
import com.github.dominikschlosser.federation.trust.FederationConfiguration;
import com.github.dominikschlosser.federation.trust.TrustRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jboss.logging.Logger;

/**
 * Resolves a canonical identity to the one pre-existing principal of a provider.
 *
 * <p>The lookup value is the identity attribute named by the provider's correlation policy. Exactly
 * one match is accepted. No match, several matches, a timed out lookup and an unreachable
 * directory are distinct errors, and none of them ever results in picking or creating a principal.
 * Every attempt is audited.
 */
public class CorrelationResolver {

    private static final Logger logger = Logger.getLogger(CorrelationResolver.class);

    private final TrustRegistry trustRegistry;
    private final PrincipalDirectory directory;
    private final ExecutorService lookupExecutor;
    private final AuditEmitter auditEmitter;
    private final Duration defaultTimeout;

    public CorrelationResolver(
            TrustRegistry trustRegistry,
            PrincipalDirectory directory,
            ExecutorService lookupExecutor,
            AuditEmitter auditEmitter,
            Duration defaultTimeout) {
        this.trustRegistry = Objects.requireNonNull(trustRegistry, "trustRegistry");
        this.directory = Objects.requireNonNull(directory, "directory");
        this.lookupExecutor = Objects.requireNonNull(lookupExecutor, "lookupExecutor");
        this.auditEmitter = Objects.requireNonNull(auditEmitter, "auditEmitter");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout");
    }

    public PrincipalHandle resolvePrincipal(CanonicalIdentity identity, String providerId) {
        return resolvePrincipal(trustRegistry.snapshot(), identity, providerId, defaultTimeout);
    }

    /**
     * @throws CorrelationException {@link RejectionReason#NO_USER_FOUND},
     *     {@link RejectionReason#AMBIGUOUS}, {@link RejectionReason#TIMEOUT},
     *     {@link RejectionReason#PRINCIPAL_INACTIVE}, {@link RejectionReason#DIRECTORY_UNAVAILABLE}
     *     or {@link RejectionReason#CANCELLED}
     */
    public PrincipalHandle resolvePrincipal(
            FederationConfiguration config, CanonicalIdentity identity, String providerId, Duration timeout) {
        if (config.getProvider(providerId).isEmpty()) {
            throw new FederationException(RejectionReason.UNKNOWN_PROVIDER, "Unknown provider " + providerId);
        }
        CorrelationPolicy policy = config.getCorrelationPolicy(providerId)
                .orElseThrow(() -> new FederationException(
                        RejectionReason.INVALID_CONFIGURATION,
                        "Provider " + providerId + " has no correlation policy"));

        try {
            PrincipalHandle principal = lookup(policy, identity, timeout);
            Map<String, String> details = new LinkedHashMap<>();
            details.put("principal_id", principal.getPrincipalId());
            details.put("attribute_key", policy.getAttributeKey());
            auditEmitter.record(identity.getTraceId(), providerId, AuditEventType.CORRELATION,
                    AuditOutcome.CORRELATED, identity.getSubject(), details);
            logger.debugf("trace=%s: correlated %s to %s at %s",
                    identity.getTraceId(), identity.getSubject(), principal.getPrincipalId(), providerId);
            return principal;
        } catch (CorrelationException e) {
            auditEmitter.record(identity.getTraceId(), providerId, AuditEventType.CORRELATION,
                    AuditOutcome.rejected(e.getReason()), identity.getSubject(),
                    Map.of("attribute_key", policy.getAttributeKey()));
            throw e;
        }
    }

    private PrincipalHandle lookup(CorrelationPolicy policy, CanonicalIdentity identity, Duration timeout) {
        String providerId = policy.getProviderId();
        String key = policy.getAttributeKey();
        String value = identity.getAttribute(key);
        if (value == null || value.isEmpty()) {
            throw new CorrelationException(
                    RejectionReason.NO_USER_FOUND,
                    "Identity carries no '" + key + "' attribute to correlate with " + providerId);
        }

        Future<List<PrincipalHandle>> pending;
        try {
            pending = lookupExecutor.submit(() -> directory.lookupPrincipal(providerId, key, value));
        } catch (RejectedExecutionException e) {
            throw new CorrelationException(
                    RejectionReason.DIRECTORY_UNAVAILABLE, "No capacity to query the directory of " + providerId, e);
        }
        List<PrincipalHandle> results;
        try {
            results = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new CorrelationException(
                    RejectionReason.TIMEOUT, "Directory lookup at " + providerId + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new CorrelationException(
                    RejectionReason.CANCELLED, "Directory lookup at " + providerId + " was cancelled", e);
        } catch (ExecutionException e) {
            throw new CorrelationException(
                    RejectionReason.DIRECTORY_UNAVAILABLE,
                    "Directory lookup at " + providerId + " failed: " + e.getCause().getMessage(),
                    e.getCause());
        }

        if (results == null) {
            throw new CorrelationException(
                    RejectionReason.DIRECTORY_UNAVAILABLE, "Directory at " + providerId + " returned no result list");
        }

        List<PrincipalHandle> distinct = new ArrayList<>();
        for (PrincipalHandle candidate : results) {
            if (candidate == null) {
                throw new CorrelationException(
                        RejectionReason.DIRECTORY_UNAVAILABLE, "Directory at " + providerId + " returned a null entry");
            }
            if (distinct.stream().noneMatch(p -> p.getPrincipalId().equals(candidate.getPrincipalId()))) {
                distinct.add(candidate);
            }
        }

        if (distinct.isEmpty()) {
            throw new CorrelationException(
                    RejectionReason.NO_USER_FOUND, "No user returned via correlation policy of " + providerId);
        }
        if (distinct.size() > 1) {
            throw new CorrelationException(
                    RejectionReason.AMBIGUOUS,
                    distinct.size() + " principals of " + providerId
                            + " match the correlation attribute '" + key + "'");
        }

        PrincipalHandle principal = distinct.get(0);
        if (policy.getMode() == CorrelationMode.MATCH_EXISTING_OR_REJECT && !principal.isActive()) {
            throw new CorrelationException(
                    RejectionReason.PRINCIPAL_INACTIVE,
                    "Principal " + principal.getPrincipalId() + " of " + providerId + " is not active");
        }
        return principal;
    }
}
