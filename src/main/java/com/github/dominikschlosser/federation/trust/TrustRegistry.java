package com.github.dominikschlosser.federation.trust;

import com.github.dominikschlosser.federation.audit.AuditEmitter;
import com.github.dominikschlosser.federation.audit.AuditEventType;
import com.github.dominikschlosser.federation.audit.AuditOutcome;
import com.github.dominikschlosser.federation.representations.FederationConfigRepresentation;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.jboss.logging.Logger;

/**
 * Holds the active {@link FederationConfiguration} snapshot.
 *
 * <p>Readers take the current snapshot without locking. {@link #reload} validates a complete new
 * document and swaps it in with a single reference write; if validation fails the previous
 * snapshot stays active. Reloads themselves are serialized.
 */
public class TrustRegistry {

    private static final Logger logger = Logger.getLogger(TrustRegistry.class);

    static final String REGISTRY_SUBJECT = "trust-registry";

    private final AtomicReference<FederationConfiguration> current =
            new AtomicReference<>(FederationConfiguration.empty());
    private final ConfigurationValidator validator;
    private final AuditEmitter auditEmitter;

    public TrustRegistry(SigningKeyResolver signingKeyResolver, AuditEmitter auditEmitter) {
        this.validator = new ConfigurationValidator(signingKeyResolver);
        this.auditEmitter = Objects.requireNonNull(auditEmitter, "auditEmitter");
    }

    public Optional<TrustedProvider> resolveProvider(String providerId) {
        return current.get().getProvider(providerId);
    }

    /** The snapshot to use for the whole of one request. */
    public FederationConfiguration snapshot() {
        return current.get();
    }

    /**
     * Validates {@code document} and makes it the active configuration.
     *
     * @return the new snapshot
     * @throws ConfigurationException if the document is invalid; the active snapshot is unchanged
     */
    public synchronized FederationConfiguration reload(FederationConfigRepresentation document) {
        String traceId = UUID.randomUUID().toString();
        String previousVersion = current.get().getVersion();
        FederationConfiguration next;
        try {
            next = validator.validate(document);
        } catch (ConfigurationException e) {
            logger.errorf("Rejected federation configuration reload, keeping version %s: %s",
                    previousVersion, e.getErrors());
            Map<String, String> details = new LinkedHashMap<>();
            details.put("active_version", String.valueOf(previousVersion));
            details.put("error_count", String.valueOf(e.getErrors().size()));
            auditEmitter.record(traceId, null, AuditEventType.CONFIGURATION_RELOAD,
                    AuditOutcome.rejected(e.getReason()), REGISTRY_SUBJECT, details);
            throw e;
        }

        current.set(next);
        logger.infof("Federation configuration version %s active with %d providers (was %s)",
                next.getVersion(), next.getProviders().size(), previousVersion);
        Map<String, String> details = new LinkedHashMap<>();
        details.put("version", next.getVersion());
        details.put("previous_version", String.valueOf(previousVersion));
        details.put("providers", String.join(",", next.getProviders().keySet()));
        auditEmitter.record(traceId, null, AuditEventType.CONFIGURATION_RELOAD,
                AuditOutcome.RELOADED, REGISTRY_SUBJECT, details);
        return next;
    }
}
