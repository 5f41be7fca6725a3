package com.github.dominikschlosser.federation;

import com.github.dominikschlosser.federation.audit.AuditEmitter;
import com.github.dominikschlosser.federation.audit.AuditEventType;
import com.github.dominikschlosser.federation.audit.AuditOutcome;
import com.github.dominikschlosser.federation.authorization.AuthorizationHandle;
import com.github.dominikschlosser.federation.authorization.AuthorizationResolver;
import com.github.dominikschlosser.federation.correlation.CorrelationResolver;
import com.github.dominikschlosser.federation.correlation.PrincipalDirectory;
import com.github.dominikschlosser.federation.correlation.PrincipalHandle;
import com.github.dominikschlosser.federation.dynamicgroup.DynamicGroupEvaluator;
import com.github.dominikschlosser.federation.dynamicgroup.ResourceIdentity;
import com.github.dominikschlosser.federation.identity.CanonicalIdentity;
import com.github.dominikschlosser.federation.identity.HubEventVerifier;
import com.github.dominikschlosser.federation.identity.SignedHubEvent;
import com.github.dominikschlosser.federation.mapping.AttributeMappingEngine;
import com.github.dominikschlosser.federation.mapping.AttributeSet;
import com.github.dominikschlosser.federation.saml.AssertionSigner;
import com.github.dominikschlosser.federation.saml.SamlAssertion;
import com.github.dominikschlosser.federation.saml.SamlAssertionBuilder;
import com.github.dominikschlosser.federation.saml.SigningException;
import com.github.dominikschlosser.federation.trust.FederationConfiguration;
import com.github.dominikschlosser.federation.trust.TrustRegistry;
import com.github.dominikschlosser.federation.trust.TrustedProvider;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Turns one authenticated hub identity into one signed SAML assertion for one provider, or into a
 * rejection with a stable reason.
 *
 * <p>Each request reads a single configuration snapshot and runs
 * {@code map -> correlate | authorize -> build -> sign}. Every failure is fail-closed: no partial
 * assertion is returned and the rejection is audited with its reason. Requests share nothing but
 * the read-only snapshot and may run in parallel.
 *
 * <p>Dynamic group evaluation of non-human resources is a separate entry point,
 * {@link #onResourceEvent}, sharing configuration and audit but not control flow.
 */
public class FederationEngine implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(FederationEngine.class);

    public static final Duration DEFAULT_CORRELATION_TIMEOUT = Duration.ofSeconds(5);

    private final TrustRegistry trustRegistry;
    private final AttributeMappingEngine mappingEngine;
    private final CorrelationResolver correlationResolver;
    private final AuthorizationResolver authorizationResolver;
    private final DynamicGroupEvaluator dynamicGroupEvaluator;
    private final SamlAssertionBuilder assertionBuilder;
    private final AssertionSigner signer;
    private final AuditEmitter auditEmitter;
    private final HubEventVerifier hubEventVerifier;
    private final Duration correlationTimeout;
    private final ExecutorService ownedExecutor;

    private FederationEngine(Builder builder) {
        this.trustRegistry = Objects.requireNonNull(builder.trustRegistry, "trustRegistry");
        this.signer = Objects.requireNonNull(builder.signer, "assertionSigner");
        this.auditEmitter = Objects.requireNonNull(builder.auditEmitter, "auditEmitter");
        PrincipalDirectory directory = Objects.requireNonNull(builder.directory, "principalDirectory");
        this.hubEventVerifier = builder.hubEventVerifier;
        this.correlationTimeout = builder.correlationTimeout;

        ExecutorService lookupExecutor = builder.lookupExecutor;
        if (lookupExecutor == null) {
            lookupExecutor = Executors.newCachedThreadPool(new LookupThreadFactory());
            this.ownedExecutor = lookupExecutor;
        } else {
            this.ownedExecutor = null;
        }

        this.mappingEngine = new AttributeMappingEngine(trustRegistry);
        this.correlationResolver = new CorrelationResolver(
                trustRegistry, directory, lookupExecutor, auditEmitter, correlationTimeout);
        this.authorizationResolver = new AuthorizationResolver(trustRegistry);
        this.dynamicGroupEvaluator = new DynamicGroupEvaluator(trustRegistry);
        this.assertionBuilder = new SamlAssertionBuilder(builder.clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    public FederationResult federate(CanonicalIdentity identity, String providerId) {
        return federate(identity, providerId, correlationTimeout);
    }

    /**
     * @param correlationTimeout upper bound for the directory lookup of correlating providers
     */
    public FederationResult federate(CanonicalIdentity identity, String providerId, Duration correlationTimeout) {
        Objects.requireNonNull(identity, "identity");
        FederationTransaction transaction = new FederationTransaction(identity.getTraceId(), providerId);
        FederationConfiguration config = trustRegistry.snapshot();
        try {
            return run(config, transaction, identity, providerId, correlationTimeout);
        } catch (FederationException e) {
            return reject(transaction, identity.getSubject(), e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            logger.errorf(e, "trace=%s: unexpected failure federating to %s", identity.getTraceId(), providerId);
            return reject(transaction, identity.getSubject(), RejectionReason.ASSERTION_BUILD_FAILED,
                    "Unexpected failure: " + e.getClass().getSimpleName());
        }
    }

    /**
     * Verifies a signed hub event and federates the identity it carries.
     *
     * @throws IllegalStateException if the engine was built without a {@link HubEventVerifier}
     */
    public FederationResult federate(SignedHubEvent event, String providerId) {
        if (hubEventVerifier == null) {
            throw new IllegalStateException("No hub event verifier configured");
        }
        CanonicalIdentity identity;
        try {
            identity = hubEventVerifier.verify(event);
        } catch (FederationException e) {
            FederationTransaction transaction = new FederationTransaction(UUID.randomUUID().toString(), providerId);
            return reject(transaction, null, e.getReason(), e.getMessage());
        } catch (RuntimeException e) {
            FederationTransaction transaction = new FederationTransaction(UUID.randomUUID().toString(), providerId);
            logger.errorf(e, "trace=%s: hub event verification failed unexpectedly", transaction.getTraceId());
            return reject(transaction, null, RejectionReason.INVALID_EVENT,
                    "Unexpected failure: " + e.getClass().getSimpleName());
        }
        return federate(identity, providerId);
    }

    /**
     * Computes the dynamic groups of a resource after a lifecycle event and audits the result. The
     * membership is returned to the caller to apply.
     *
     * @param traceId may be {@code null}; a new one is generated
     */
    public SortedSet<String> onResourceEvent(ResourceIdentity resource, String traceId) {
        Objects.requireNonNull(resource, "resource");
        String trace = traceId != null ? traceId : UUID.randomUUID().toString();
        FederationConfiguration config = trustRegistry.snapshot();
        SortedSet<String> groups = dynamicGroupEvaluator.evaluate(config, resource);

        Map<String, String> details = new LinkedHashMap<>();
        details.put("groups", String.join(",", groups));
        details.put("config_version", String.valueOf(config.getVersion()));
        auditEmitter.record(trace, null, AuditEventType.DYNAMIC_GROUP_EVALUATION, AuditOutcome.EVALUATED,
                resource.getResourceId(), details);
        logger.debugf("trace=%s: resource %s is in %d dynamic groups", trace, resource.getResourceId(), groups.size());
        return groups;
    }

    private FederationResult run(
            FederationConfiguration config,
            FederationTransaction transaction,
            CanonicalIdentity identity,
            String providerId,
            Duration timeout) {
        TrustedProvider provider = config.getProvider(providerId)
                .orElseThrow(() -> new FederationException(
                        RejectionReason.UNKNOWN_PROVIDER, "Unknown provider " + providerId));

        AttributeSet attributes = mappingEngine.mapAttributes(config, identity, providerId);
        transaction.advance(FederationState.MAPPED);

        PrincipalHandle principal = null;
        AuthorizationHandle authorization = null;
        if (provider.isRequiresCorrelation()) {
            principal = correlationResolver.resolvePrincipal(config, identity, providerId, timeout);
            transaction.advance(FederationState.CORRELATED);
        } else if (provider.isRequiresAuthorization()) {
            authorization = authorizationResolver.resolveAuthorization(config, identity, providerId);
            transaction.advance(FederationState.AUTHORIZED);
        }

        if (provider.getGroupsAttributeName() != null) {
            SortedSet<String> groups = authorizationResolver.resolveProviderGroups(config, identity, providerId);
            if (!groups.isEmpty()) {
                attributes = attributes.toBuilder().addAll(provider.getGroupsAttributeName(), groups).build();
            }
        }

        SamlAssertion assertion = assertionBuilder.buildAssertion(
                config.getIssuer(), identity, provider, attributes, authorization, principal);
        transaction.advance(FederationState.BUILT);

        checkNotCancelled(transaction);
        String signed = sign(assertion, provider);
        transaction.advance(FederationState.SIGNED);

        checkNotCancelled(transaction);
        transaction.advance(FederationState.ISSUED);

        Map<String, String> details = new LinkedHashMap<>();
        details.put("assertion_id", assertion.getId());
        details.put("audience", assertion.getAudience());
        details.put("name_id_format", provider.getNameIdFormat().getUri().get());
        details.put("config_version", String.valueOf(config.getVersion()));
        auditEmitter.record(identity.getTraceId(), providerId, AuditEventType.FEDERATION, AuditOutcome.ISSUED,
                identity.getSubject(), details);
        logger.infof("trace=%s: issued assertion %s to %s", identity.getTraceId(), assertion.getId(), providerId);
        return FederationResult.issued(transaction, assertion, signed, authorization, principal);
    }

    private String sign(SamlAssertion assertion, TrustedProvider provider) {
        String signed;
        try {
            signed = signer.sign(assertion.getUnsignedPayload(), provider.getSigningKeyRef(),
                    provider.getSignatureAlgorithm());
        } catch (SigningException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SigningException(RejectionReason.SIGNING_FAILED,
                    "Signing with key " + provider.getSigningKeyRef() + " failed: " + e.getMessage(), e);
        }
        if (signed == null || signed.isEmpty()) {
            throw new SigningException(RejectionReason.SIGNING_FAILED,
                    "Signing collaborator returned no payload for key " + provider.getSigningKeyRef());
        }
        return signed;
    }

    private static void checkNotCancelled(FederationTransaction transaction) {
        if (Thread.currentThread().isInterrupted()) {
            throw new FederationException(
                    RejectionReason.CANCELLED, "Request " + transaction.getTraceId() + " was cancelled");
        }
    }

    private FederationResult reject(
            FederationTransaction transaction, String subject, RejectionReason reason, String message) {
        if (!transaction.getState().isTerminal()) {
            transaction.reject(reason);
        }
        Map<String, String> details = new LinkedHashMap<>();
        details.put("state", transaction.getHistory().get(transaction.getHistory().size() - 2).name());
        details.put("message", message);
        auditEmitter.record(transaction.getTraceId(), transaction.getProviderId(), AuditEventType.FEDERATION,
                AuditOutcome.rejected(reason), subject, details);
        logger.warnf("trace=%s: rejected federation to %s: %s", transaction.getTraceId(),
                transaction.getProviderId(), reason.getCode());
        return FederationResult.rejected(transaction, reason, message);
    }

    public TrustRegistry getTrustRegistry() {
        return trustRegistry;
    }

    /** Shuts down the lookup executor if the engine created it. The audit emitter is left open. */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private static final class LookupThreadFactory implements ThreadFactory {

        private static final AtomicInteger COUNTER = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "federation-directory-lookup-" + COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static final class Builder {

        private TrustRegistry trustRegistry;
        private PrincipalDirectory directory;
        private AssertionSigner signer;
        private AuditEmitter auditEmitter;
        private HubEventVerifier hubEventVerifier;
        private ExecutorService lookupExecutor;
        private Duration correlationTimeout = DEFAULT_CORRELATION_TIMEOUT;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder trustRegistry(TrustRegistry trustRegistry) {
            this.trustRegistry = trustRegistry;
            return this;
        }

        public Builder principalDirectory(PrincipalDirectory directory) {
            this.directory = directory;
            return this;
        }

        public Builder assertionSigner(AssertionSigner signer) {
            this.signer = signer;
            return this;
        }

        public Builder auditEmitter(AuditEmitter auditEmitter) {
            this.auditEmitter = auditEmitter;
            return this;
        }

        public Builder hubEventVerifier(HubEventVerifier hubEventVerifier) {
            this.hubEventVerifier = hubEventVerifier;
            return this;
        }

        /** Executor for directory lookups. When not set, the engine creates and owns one. */
        public Builder lookupExecutor(ExecutorService lookupExecutor) {
            this.lookupExecutor = lookupExecutor;
            return this;
        }

        public Builder correlationTimeout(Duration correlationTimeout) {
            this.correlationTimeout = Objects.requireNonNull(correlationTimeout, "correlationTimeout");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public FederationEngine build() {
            return new FederationEngine(this);
        }
    }
}
