package com.github.dominikschlosser.federation.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One append-only audit entry.
 *
 * <p>Carries identifiers only: subject, provider, principal or resource ids. Attribute values,
 * assertions and key material never end up here.
 */
public final class AuditRecord {

    private final String traceId;
    private final String providerId;
    private final AuditEventType eventType;
    private final AuditOutcome outcome;
    private final String subject;
    private final Instant timestamp;
    private final Map<String, String> details;

    public AuditRecord(
            String traceId,
            String providerId,
            AuditEventType eventType,
            AuditOutcome outcome,
            String subject,
            Instant timestamp,
            Map<String, String> details) {
        this.traceId = Objects.requireNonNull(traceId, "traceId");
        this.providerId = providerId;
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.subject = subject;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getTraceId() {
        return traceId;
    }

    public String getProviderId() {
        return providerId;
    }

    public AuditEventType getEventType() {
        return eventType;
    }

    public AuditOutcome getOutcome() {
        return outcome;
    }

    public String getSubject() {
        return subject;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, String> getDetails() {
        return details;
    }

    /** Flat, JSON-friendly view used by sinks and reports. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("timestamp", timestamp.toString());
        map.put("trace_id", traceId);
        map.put("event", eventType.getValue());
        if (providerId != null) {
            map.put("provider_id", providerId);
        }
        if (subject != null) {
            map.put("subject", subject);
        }
        map.put("outcome", outcome.toString());
        if (!details.isEmpty()) {
            map.put("details", details);
        }
        return map;
    }

    @Override
    public String toString() {
        return "AuditRecord" + toMap();
    }
}
